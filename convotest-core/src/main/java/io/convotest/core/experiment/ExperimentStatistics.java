package io.convotest.core.experiment;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

public final class ExperimentStatistics {
    private static final double Z_95 = 1.959963984540054;

    private ExperimentStatistics() {
    }

    public static ExperimentAnalysis analyze(Experiment experiment, List<ExperimentRun> runs) {
        ExperimentVariant controlVariant = experiment.control()
            .orElseThrow(() -> new IllegalStateException("Experiment " + experiment.experimentId() + " has no control variant"));
        List<ExperimentVariant> treatmentVariants = experiment.treatments();
        if (treatmentVariants.isEmpty()) {
            throw new IllegalStateException("Experiment " + experiment.experimentId() + " has no treatment variant");
        }

        VariantStats control = variantStats(controlVariant, runs);
        List<VariantStats> treatments = new ArrayList<>();
        List<VariantComparison> comparisons = new ArrayList<>();
        for (ExperimentVariant treatmentVariant : treatmentVariants) {
            VariantStats treatment = variantStats(treatmentVariant, runs);
            treatments.add(treatment);
            comparisons.add(compare(control, treatment, experiment.significanceThreshold()));
        }

        int min = experiment.minSampleSize();
        boolean minimumReached = control.sampleSize() >= min
            && treatments.stream().allMatch(t -> t.sampleSize() >= min);

        String winner = null;
        Recommendation recommendation;
        String reason;
        Optional<VariantComparison> bestUp = comparisons.stream()
            .filter(VariantComparison::significant)
            .filter(c -> c.passRateDifference() > 0)
            .max((a, b) -> Double.compare(a.passRateDifference(), b.passRateDifference()));
        Optional<VariantComparison> worstDown = comparisons.stream()
            .filter(VariantComparison::significant)
            .filter(c -> c.passRateDifference() < 0)
            .min((a, b) -> Double.compare(a.passRateDifference(), b.passRateDifference()));

        if (minimumReached && bestUp.isPresent()) {
            VariantComparison best = bestUp.get();
            winner = best.treatmentVariantId();
            recommendation = Recommendation.ADOPT_TREATMENT;
            reason = String.format(
                Locale.ROOT,
                "Treatment %s has %.1f%% higher pass rate with statistical significance (p=%.4f)",
                best.treatmentVariantId(),
                best.passRateLift(),
                best.pValue()
            );
        } else if (minimumReached && worstDown.isPresent()) {
            VariantComparison worst = worstDown.get();
            winner = control.variantId();
            recommendation = Recommendation.KEEP_CONTROL;
            reason = String.format(
                Locale.ROOT,
                "Control has %.1f%% higher pass rate than %s with statistical significance (p=%.4f)",
                Math.abs(worst.passRateLift()),
                worst.treatmentVariantId(),
                worst.pValue()
            );
        } else if (minimumReached) {
            recommendation = Recommendation.NO_DIFFERENCE;
            double bestP = comparisons.stream().mapToDouble(VariantComparison::pValue).min().orElse(1.0);
            reason = String.format(
                Locale.ROOT,
                "No statistically significant difference detected (p=%.4f). Min sample size reached.",
                bestP
            );
        } else {
            recommendation = Recommendation.CONTINUE;
            StringBuilder builder = new StringBuilder("Insufficient samples. Control: ")
                .append(control.sampleSize()).append('/').append(min);
            for (VariantStats treatment : treatments) {
                builder.append(", ").append(treatment.variantId()).append(": ")
                    .append(treatment.sampleSize()).append('/').append(min);
            }
            reason = builder.toString();
        }

        return new ExperimentAnalysis(
            experiment.experimentId(),
            experiment.status(),
            control,
            treatments,
            comparisons,
            minimumReached,
            winner,
            recommendation,
            reason
        );
    }

    static VariantStats variantStats(ExperimentVariant variant, List<ExperimentRun> allRuns) {
        List<ExperimentRun> runs = allRuns.stream()
            .filter(r -> r.variantId().equals(variant.variantId()))
            .toList();
        int n = runs.size();
        if (n == 0) {
            return new VariantStats(variant.variantId(), variant.role(), 0, 0, 0.0, 0.0, 0.0, 0.0, 0.0, 0.0, 0.0);
        }
        int passCount = (int) runs.stream().filter(ExperimentRun::passed).count();
        int errors = (int) runs.stream().filter(ExperimentRun::errorOccurred).count();
        double[] interval = wilsonInterval(passCount, n);
        return new VariantStats(
            variant.variantId(),
            variant.role(),
            n,
            passCount,
            (double) passCount / n,
            runs.stream().mapToDouble(r -> r.metrics().goalCompletionRate()).average().orElse(0.0),
            runs.stream().mapToDouble(r -> r.metrics().turnCount()).average().orElse(0.0),
            runs.stream().mapToDouble(r -> r.metrics().durationMs()).average().orElse(0.0),
            (double) errors / n,
            interval[0],
            interval[1]
        );
    }

    static VariantComparison compare(VariantStats control, VariantStats treatment, double threshold) {
        double difference = treatment.passRate() - control.passRate();
        double lift = control.passRate() == 0.0 ? 0.0 : difference / control.passRate() * 100.0;
        int n1 = control.sampleSize();
        int n2 = treatment.sampleSize();
        if (n1 < 2 || n2 < 2) {
            return new VariantComparison(treatment.variantId(), control.passRate(), treatment.passRate(),
                difference, lift, 0.0, 1.0, false);
        }
        double pooled = (double) (control.passCount() + treatment.passCount()) / (n1 + n2);
        double se = Math.sqrt(pooled * (1 - pooled) * (1.0 / n1 + 1.0 / n2));
        if (se == 0.0) {
            return new VariantComparison(treatment.variantId(), control.passRate(), treatment.passRate(),
                difference, lift, 0.0, 1.0, false);
        }
        double z = difference / se;
        double p = 2.0 * (1.0 - normalCdf(Math.abs(z)));
        p = Math.max(0.0, Math.min(1.0, p));
        return new VariantComparison(treatment.variantId(), control.passRate(), treatment.passRate(),
            difference, lift, z, p, p < threshold);
    }

    static double normalCdf(double z) {
        return 0.5 * (1.0 + erf(z / Math.sqrt(2.0)));
    }

    // Abramowitz and Stegun 7.1.26, absolute error below 1.5e-7.
    private static double erf(double x) {
        double sign = x < 0 ? -1.0 : 1.0;
        double ax = Math.abs(x);
        double t = 1.0 / (1.0 + 0.3275911 * ax);
        double poly = ((((1.061405429 * t - 1.453152027) * t + 1.421413741) * t - 0.284496736) * t + 0.254829592) * t;
        return sign * (1.0 - poly * Math.exp(-ax * ax));
    }

    private static double[] wilsonInterval(int successes, int total) {
        double p = (double) successes / total;
        double z2 = Z_95 * Z_95;
        double denominator = 1 + z2 / total;
        double center = (p + z2 / (2.0 * total)) / denominator;
        double margin = (Z_95 / denominator) * Math.sqrt(p * (1 - p) / total + z2 / (4.0 * total * total));
        return new double[] {Math.max(0.0, center - margin), Math.min(1.0, center + margin)};
    }
}
