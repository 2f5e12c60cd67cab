package io.convotest.core.extract;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.convotest.core.progress.CollectableField;
import java.util.List;
import org.junit.jupiter.api.Test;

class VolunteeredDataExtractorTest {
    private final VolunteeredDataExtractor extractor = VolunteeredDataExtractor.fromClasspath();

    @Test
    void shouldExtractSinglePhoneNumber() {
        List<ExtractedField> found = extractor.extract("Call me at 555-123-4567");

        assertThat(found).containsExactly(new ExtractedField(CollectableField.PARENT_PHONE, "555-123-4567"));
    }

    @Test
    void shouldStopNameAtStopWord() {
        List<ExtractedField> found = extractor.extract("my name is Jake, calling about an appointment");

        assertThat(found).containsExactly(new ExtractedField(CollectableField.PARENT_NAME, "Jake"));
    }

    @Test
    void shouldRejectNameStartingWithStopWord() {
        assertThat(extractor.extract("Hi, I'm calling about my daughter")).isEmpty();
    }

    @Test
    void shouldExtractSeveralFieldsFromOneMessage() {
        List<ExtractedField> found = extractor.extract(
            "This is Maria Lopez, you can email maria.lopez@example.com and we have Aetna"
        );

        assertThat(found).extracting(ExtractedField::field).containsExactlyInAnyOrder(
            CollectableField.PARENT_NAME,
            CollectableField.PARENT_EMAIL,
            CollectableField.INSURANCE
        );
        assertThat(found).contains(new ExtractedField(CollectableField.PARENT_NAME, "Maria Lopez"));
        assertThat(found).contains(new ExtractedField(CollectableField.PARENT_EMAIL, "maria.lopez@example.com"));
        assertThat(found).contains(new ExtractedField(CollectableField.INSURANCE, "Aetna"));
    }

    @Test
    void shouldReturnNothingForBlankMessage() {
        assertThat(extractor.extract("")).isEmpty();
        assertThat(extractor.extract(null)).isEmpty();
        assertThat(extractor.rulesVersion()).isEqualTo(1);
    }

    @Test
    void shouldFailOnMissingRulesResource() {
        assertThatThrownBy(() -> VolunteeredDataExtractor.fromClasspath("/no-such-rules.json"))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("/no-such-rules.json");
    }
}
