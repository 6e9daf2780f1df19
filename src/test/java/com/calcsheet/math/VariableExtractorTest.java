package com.calcsheet.math;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class VariableExtractorTest {

    @Test
    void splitsLetterRuns() {
        assertEquals("b*h", VariableExtractor.addImplicitMultiplication("bh"));
        assertEquals("a*b*c", VariableExtractor.addImplicitMultiplication("abc"));
    }

    @Test
    void digitBeforeLetter() {
        assertEquals("2*x", VariableExtractor.addImplicitMultiplication("2x"));
    }

    @Test
    void parenthesesImplyProducts() {
        assertEquals("a*(b + c)", VariableExtractor.addImplicitMultiplication("a(b + c)"));
        assertEquals("(a)*(b)", VariableExtractor.addImplicitMultiplication("(a)(b)"));
    }

    @Test
    void reservedAndSubscriptedNamesStayWhole() {
        assertEquals("sin(theta)", VariableExtractor.addImplicitMultiplication("sin(theta)"));
        assertEquals("x_cg_prime", VariableExtractor.addImplicitMultiplication("x_cg_prime"));
        assertEquals("delta_x", VariableExtractor.addImplicitMultiplication("delta_x"));
    }

    @Test
    void extractsFreeIdentifiersInOrder() {
        assertEquals(List.of("x", "alpha"), VariableExtractor.extractVariables("sin(x) + alpha"));
        assertEquals(List.of("F", "m", "a"), VariableExtractor.extractVariables("F = m*a"));
        assertEquals(List.of("r"), VariableExtractor.extractVariables("pi*r**2"));
        assertEquals(List.of("x", "y_1"), VariableExtractor.extractVariables("2x + y_1"));
    }

    @Test
    void extractsFromMarkup() {
        assertEquals(List.of("F", "m"), VariableExtractor.extractVariables("\\frac{F}{m}"));
        assertEquals(List.of("b", "h"), VariableExtractor.extractVariables("bh"));
    }

    @Test
    void emptyInput() {
        assertTrue(VariableExtractor.extractVariables("").isEmpty());
        assertTrue(VariableExtractor.extractVariables(null).isEmpty());
    }
}
