package org.javai.jobguard.classify;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.*;

class ClassificationTableTest {

    @Test
    void defaults_knowThrottlingAndAccessCodes() {
        ClassificationTable table = ClassificationTable.defaults();

        assertThat(table.classOfCode("ThrottlingException")).contains(ErrorClass.RETRYABLE);
        assertThat(table.classOfCode("RequestLimitExceeded")).contains(ErrorClass.RETRYABLE);
        assertThat(table.classOfCode("AccessDeniedException")).contains(ErrorClass.FATAL);
        assertThat(table.classOfCode("ResourceNotFoundException")).isEmpty();
        assertThat(table.classOfCode(null)).isEmpty();
    }

    @Test
    void codes_areCaseSensitive() {
        assertThat(ClassificationTable.defaults().classOfCode("throttlingexception")).isEmpty();
    }

    @Test
    void findPhrase_ignoresCase() {
        ClassificationTable table = ClassificationTable.defaults();

        assertThat(table.findPhrase("Rate Exceeded for account")).contains("rate exceeded");
        assertThat(table.findPhrase("dial tcp: lookup backup.example: NO SUCH HOST")).contains("no such host");
        assertThat(table.findPhrase("invalid parameter value")).isEmpty();
        assertThat(table.findPhrase(null)).isEmpty();
        assertThat(table.findPhrase("")).isEmpty();
    }

    @Test
    void findPhrase_returnsFirstPhraseInTableOrder() {
        // "gateway timeout" is listed after "timeout"
        Optional<String> phrase = ClassificationTable.defaults().findPhrase("504 Gateway Timeout");

        assertThat(phrase).contains("timeout");
    }

    @Test
    void builder_fromDefaults_canOverrideEntries() {
        ClassificationTable table = ClassificationTable.builder()
                .fromDefaults()
                .code("InternalError", ErrorClass.FATAL)
                .phrase("Quota Exceeded", ErrorClass.FATAL)
                .build();

        assertThat(table.classOfCode("InternalError")).contains(ErrorClass.FATAL);
        assertThat(table.classOfCode("Throttling")).contains(ErrorClass.RETRYABLE);
        assertThat(table.findPhrase("backup quota exceeded")).contains("quota exceeded");
        assertThat(table.classOfPhrase("quota exceeded")).isEqualTo(ErrorClass.FATAL);
    }

    @Test
    void builder_withoutDefaults_startsEmpty() {
        ClassificationTable table = ClassificationTable.builder()
                .code("Busy", ErrorClass.RETRYABLE)
                .build();

        assertThat(table.codes()).containsOnlyKeys("Busy");
        assertThat(table.phrases()).isEmpty();
    }

    @Test
    void builder_rejectsBlankEntries() {
        assertThatThrownBy(() -> ClassificationTable.builder().code(" ", ErrorClass.FATAL))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ClassificationTable.builder().phrase("", ErrorClass.FATAL))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void classOfPhrase_unknownPhrase_isRejected() {
        assertThatThrownBy(() -> ClassificationTable.defaults().classOfPhrase("not in table"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void tables_areImmutable() {
        assertThatThrownBy(() -> ClassificationTable.defaults().codes().put("X", ErrorClass.FATAL))
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
