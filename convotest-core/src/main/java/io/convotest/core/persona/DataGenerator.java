package io.convotest.core.persona;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Locale;
import java.util.Random;

public final class DataGenerator {
    static final List<String> FIRST_NAMES = List.of(
        "Emma", "Olivia", "Ava", "Sophia", "Mia", "Amelia", "Harper", "Evelyn", "Abigail", "Ella",
        "Liam", "Noah", "Oliver", "Elijah", "James", "William", "Benjamin", "Lucas", "Henry", "Jake",
        "Grace", "Chloe", "Nora", "Lily", "Zoe", "Ethan", "Mason", "Logan", "Caleb", "Owen"
    );
    static final List<String> LAST_NAMES = List.of(
        "Smith", "Johnson", "Williams", "Brown", "Jones", "Garcia", "Miller", "Davis", "Rodriguez",
        "Martinez", "Wilson", "Anderson", "Taylor", "Thomas", "Moore", "Jackson", "Martin", "Lee",
        "Thompson", "White", "Harris", "Clark", "Lewis", "Walker", "Hall", "Young", "King"
    );
    static final List<String> EMAIL_DOMAINS = List.of("gmail.com", "yahoo.com", "outlook.com", "example.com");
    static final List<String> INSURANCE_PROVIDERS = List.of(
        "Aetna", "Blue Cross Blue Shield", "Cigna", "Delta Dental", "Guardian", "MetLife",
        "United Healthcare", "Humana"
    );
    static final List<String> LOCATIONS = List.of("Alleghany", "Philadelphia");
    static final List<String> TIMES_OF_DAY = List.of("morning", "afternoon", "any");
    static final List<String> SPECIAL_NEEDS = List.of("Autism", "ADHD", "Anxiety", "Sensory sensitivity");

    private final long seed;
    private final Random random;
    private final LocalDate today;

    public DataGenerator(long seed, LocalDate today) {
        this.seed = seed;
        this.random = new Random(seed);
        this.today = today;
    }

    public long seed() {
        return seed;
    }

    public Object generate(DynamicFieldSpec spec) {
        FieldConstraints c = spec.constraints();
        return switch (spec.fieldType()) {
            case FIRST_NAME -> affix(c, pick(FIRST_NAMES));
            case LAST_NAME -> affix(c, pick(LAST_NAMES));
            case FULL_NAME -> affix(c, pick(FIRST_NAMES) + " " + pick(LAST_NAMES));
            case PHONE -> phone(c.phoneFormat());
            case EMAIL -> affix(c, email());
            case DATE -> date(c).toString();
            case DATE_OF_BIRTH -> dateOfBirth(c).toString();
            case BOOLEAN -> random.nextDouble() < (c.probability() == null ? 0.5 : c.probability());
            case INSURANCE_PROVIDER -> pickOr(c.options(), INSURANCE_PROVIDERS);
            case INSURANCE_ID -> affix(c, insuranceId());
            case LOCATION -> pickOr(c.options(), LOCATIONS);
            case TIME_OF_DAY -> pickOr(c.options(), TIMES_OF_DAY);
            case SPECIAL_NEEDS -> specialNeeds(c);
        };
    }

    private String phone(String format) {
        String safe = format == null || format.isBlank() ? "##########" : format;
        if ("##########".equals(safe) || "###-###-####".equals(safe)) {
            int area = 200 + random.nextInt(800);
            int exchange = 200 + random.nextInt(800);
            int subscriber = 1000 + random.nextInt(9000);
            String sep = safe.contains("-") ? "-" : "";
            return area + sep + exchange + sep + subscriber;
        }
        StringBuilder out = new StringBuilder();
        for (char ch : safe.toCharArray()) {
            out.append(ch == '#' ? Character.forDigit(random.nextInt(10), 10) : ch);
        }
        return out.toString();
    }

    private String email() {
        String local = pick(FIRST_NAMES) + "." + pick(LAST_NAMES) + random.nextInt(100);
        return (local + "@" + pick(EMAIL_DOMAINS)).toLowerCase(Locale.ROOT);
    }

    private LocalDate date(FieldConstraints c) {
        LocalDate from = c.minDate() == null ? LocalDate.of(today.getYear(), 1, 1) : c.minDate();
        LocalDate to = c.maxDate() == null ? LocalDate.of(today.getYear(), 12, 31) : c.maxDate();
        return between(from, to);
    }

    private LocalDate dateOfBirth(FieldConstraints c) {
        int minAge = c.minAge() == null ? 7 : c.minAge();
        int maxAge = c.maxAge() == null ? 18 : c.maxAge();
        LocalDate latest = today.minusYears(minAge);
        LocalDate earliest = today.minusYears(maxAge + 1L).plusDays(1);
        return between(earliest, latest);
    }

    private LocalDate between(LocalDate from, LocalDate to) {
        long days = ChronoUnit.DAYS.between(from, to);
        if (days <= 0) {
            return from;
        }
        return from.plusDays((long) (random.nextDouble() * (days + 1)));
    }

    private String insuranceId() {
        StringBuilder out = new StringBuilder();
        for (int i = 0; i < 3; i++) {
            out.append((char) ('A' + random.nextInt(26)));
        }
        for (int i = 0; i < 9; i++) {
            out.append(random.nextInt(10));
        }
        return out.toString();
    }

    private String specialNeeds(FieldConstraints c) {
        double probability = c.probability() == null ? 0.1 : c.probability();
        if (random.nextDouble() >= probability) {
            return "None";
        }
        List<String> options = (c.options().isEmpty() ? SPECIAL_NEEDS : c.options()).stream()
            .filter(option -> !"none".equalsIgnoreCase(option))
            .toList();
        return options.isEmpty() ? "None" : pick(options);
    }

    private String pickOr(List<String> options, List<String> fallback) {
        return pick(options.isEmpty() ? fallback : options);
    }

    private String pick(List<String> pool) {
        return pool.get(random.nextInt(pool.size()));
    }

    private String affix(FieldConstraints c, String value) {
        return c.prefix() + value + c.suffix();
    }
}
