package com.ryuqq.delegation.core.exception;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * 위임 예외 오류 코드 / 메시지 테스트.
 *
 * @author Delegation Team
 * @since 1.0.0
 */
class DelegationExceptionTest {

    @Test
    void duplicateProperty_CarriesKeyAndOccurrences() {
        // when
        DuplicatePropertyException e = new DuplicatePropertyException("foo", 3);

        // then
        assertThat(e.getErrorCode()).isEqualTo("DLG-DUPLICATE");
        assertThat(e.getKey()).isEqualTo("foo");
        assertThat(e.getOccurrences()).isEqualTo(3);
        assertThat(e).hasMessage(
            "Property 'foo' exists in 3 sources. Duplication of properties in the hierarchy is disallowed.");
    }

    @Test
    void missingProperty_CarriesKey() {
        // when
        MissingPropertyException e = new MissingPropertyException("bar");

        // then
        assertThat(e.getErrorCode()).isEqualTo("DLG-MISSING");
        assertThat(e.getKey()).isEqualTo("bar");
        assertThat(e).hasMessage("Property not found in hierarchy: bar");
    }

    @Test
    void unknownSource_CarriesSource() {
        // given
        Object source = "detached";

        // when
        UnknownSourceException e = new UnknownSourceException(source);

        // then
        assertThat(e.getErrorCode()).isEqualTo("DLG-SOURCE");
        assertThat(e.getSource()).isSameAs(source);
        assertThat(e).hasMessageContaining("detached");
    }

    @Test
    void errorCodes_AreDistinct() {
        assertThat(new String[] {
            DuplicatePropertyException.ERROR_CODE,
            MissingPropertyException.ERROR_CODE,
            OverrideDisallowedException.ERROR_CODE,
            DeletionDisallowedException.ERROR_CODE,
            UnknownSourceException.ERROR_CODE,
            UnknownOwnPropertyException.ERROR_CODE,
            OperationNotAllowedException.ERROR_CODE,
            ProtectedOperationException.ERROR_CODE
        }).doesNotHaveDuplicates().allMatch(code -> code.startsWith("DLG-"));
    }

    @Test
    void allDelegationErrors_AreUnchecked() {
        assertThat(new OverrideDisallowedException("k"))
            .isInstanceOf(DelegationException.class)
            .isInstanceOf(RuntimeException.class);
        assertThat(new DeletionDisallowedException("k").getErrorCode()).isEqualTo("DLG-DELETE");
        assertThat(new UnknownOwnPropertyException("k").getErrorCode()).isEqualTo("DLG-OWN");
        assertThat(new OperationNotAllowedException("k").getErrorCode()).isEqualTo("DLG-OP-NOT-ALLOWED");
        assertThat(new ProtectedOperationException("k").getErrorCode()).isEqualTo("DLG-OP-PROTECTED");
    }
}
