package org.minic.compiler.internal.i18n;

import org.minic.compiler.diagnostics.ErrorKind;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

@Tag("unit")
class MessagesTest {

    @Test
    void describesByKind() {
        assertEquals("undeclared variable total", Messages.describe(ErrorKind.UNDECLARED_VARIABLE, "total"));
        assertEquals("index operator expects an array", Messages.describe(ErrorKind.NON_ARRAY_INDEX));
    }

    @Test
    void largeLineNumbersAreNotGrouped() {
        assertEquals("[Line 12345] semantic error: x", Messages.diagnosticLine(12345, "x"));
    }

    @Test
    void everyKindHasATemplate() {
        for (ErrorKind kind : ErrorKind.values()) {
            assertFalse(Messages.template(kind.messageKey()).startsWith("!"), kind.name());
        }
    }

    @Test
    void missingKeyIsMarked() {
        assertEquals("!no.such.key!", Messages.template("no.such.key"));
    }
}
