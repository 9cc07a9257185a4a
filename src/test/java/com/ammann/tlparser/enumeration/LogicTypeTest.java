/* (C)2026 */
package com.ammann.tlparser.enumeration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.ammann.tlparser.analysis.TemporalKind;
import com.ammann.tlparser.exception.UnsupportedOperatorException;
import com.ammann.tlparser.exception.ValidationException;
import java.util.EnumSet;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

class LogicTypeTest {

    @ParameterizedTest
    @EnumSource(LogicType.class)
    void labelResolvesBackToLogic(LogicType type) {
        assertThat(LogicType.fromLabel(type.label())).isSameAs(type);
    }

    @Test
    void boundedMetricLogicUsesDatasetLabel() {
        assertThat(LogicType.MTLB.label()).isEqualTo("MTLb");
        assertThat(LogicType.fromLabel("MTLb")).isEqualTo(LogicType.MTLB);
    }

    @Test
    void onlyCtlStarIsBranchingTime() {
        assertThat(EnumSet.allOf(LogicType.class))
                .filteredOn(LogicType::isBranchingTime)
                .containsExactly(LogicType.CTLS);
    }

    @Test
    void linearLogicsSupportLinearOperatorsOnly() {
        assertThat(LogicType.LTL.supports(TemporalKind.U)).isTrue();
        assertThat(LogicType.LTL.supports(TemporalKind.A)).isFalse();
        assertThat(LogicType.CTLS.supports(TemporalKind.E)).isTrue();
    }

    @Test
    void checkSupportedNamesFirstOffendingOperator() {
        assertThatThrownBy(() -> LogicType.STL.checkSupported(EnumSet.of(TemporalKind.E, TemporalKind.G)))
                .isInstanceOf(UnsupportedOperatorException.class)
                .hasMessage("Operator 'E' is not supported by logic STL");
    }

    @Test
    void unknownLabelIsValidationError() {
        assertThatThrownBy(() -> LogicType.fromLabel("ltl"))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("MTLb");
    }
}
