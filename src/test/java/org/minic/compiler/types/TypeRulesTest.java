package org.minic.compiler.types;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class TypeRulesTest {

    @Test
    void onlyIntegerWidensToFloat() {
        assertThat(TypeRules.canCoerce(Type.FLOAT, Type.INT)).isTrue();
        assertThat(TypeRules.canCoerce(Type.INT, Type.FLOAT)).isFalse();
        assertThat(TypeRules.canCoerce(Type.BOOL, Type.INT)).isFalse();
        assertThat(TypeRules.canCoerce(Type.FLOAT, Type.BOOL)).isFalse();
    }

    @Test
    void assignabilityIsMatchOrWidening() {
        for (Type type : Type.values()) {
            assertThat(TypeRules.isAssignable(type, type)).as("%s to itself", type).isTrue();
        }
        assertThat(TypeRules.isAssignable(Type.FLOAT, Type.INT)).isTrue();
        assertThat(TypeRules.isAssignable(Type.INT, Type.FLOAT)).isFalse();
        assertThat(TypeRules.isAssignable(Type.INT, Type.BOOL)).isFalse();
    }

    @Test
    void onlyAnyIsTerminal() {
        assertThat(TypeRules.isTerminal(Type.ANY)).isTrue();
        assertThat(TypeRules.isTerminal(Type.VOID)).isFalse();
        assertThat(TypeRules.isTerminal(Type.INT)).isFalse();
    }

    @Test
    void namesUsedInTargetCodeAndMessages() {
        assertThat(Type.INT.targetName()).isEqualTo("int");
        assertThat(Type.BOOL.targetName()).isEqualTo("bool");
        assertThat(Type.INT.printableName()).isEqualTo("integer");
        assertThat(Type.BOOL.printableName()).isEqualTo("boolean");
        assertThat(Operator.AND.symbol()).isEqualTo("&");
        assertThat(Operator.OR.symbol()).isEqualTo("|");
        assertThat(Operator.ASSIGN.printableName()).isEqualTo("attribution");
        assertThat(Operator.TEST.printableName()).isEqualTo("test");
    }

    @Test
    void operatorCategories() {
        assertThat(Operator.LESS_EQUAL_THAN.isComparison()).isTrue();
        assertThat(Operator.PLUS.isComparison()).isFalse();
        assertThat(Operator.NOT.isBoolean()).isTrue();
        assertThat(Operator.NOT.isUnary()).isTrue();
        assertThat(Operator.MINUS.isUnary()).isFalse();
    }
}
