/* (C)2026 */
package com.ammann.tlparser.enumeration;

import com.ammann.tlparser.exception.ValidationException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;

/**
 * Whether a formalization could be translated from another logic's formalization of the
 * same requirement.
 */
public enum TranslationStatus {
    /** The formalization is the source of translations */
    SELF("self"),
    /** Translated successfully */
    YES("yes"),
    /** Translation not possible */
    NO("no"),
    /** Not assessed */
    UNKNOWN("unknown");

    private final String value;

    TranslationStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /**
     * First letter of the value, used to build a requirement's translation class.
     */
    public char initial() {
        return value.charAt(0);
    }

    @JsonCreator
    public static TranslationStatus fromValue(String value) {
        return Arrays.stream(values())
                .filter(s -> s.value.equals(value))
                .findFirst()
                .orElseThrow(() -> ValidationException.invalidParameter(
                        "translation", value, "one of self, yes, no, unknown"));
    }
}
