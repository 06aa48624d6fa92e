package com.libragraph.evidence.core.json;

import com.fasterxml.jackson.databind.JsonNode;

import java.math.BigDecimal;

final class JsonScalars {

    private JsonScalars() {
    }

    /**
     * Java value of a scalar node: {@code null}, Boolean, Long, BigDecimal or String.
     */
    static Object toJava(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isIntegralNumber()) {
            return node.canConvertToLong() ? (Object) node.longValue() : new BigDecimal(node.bigIntegerValue());
        }
        if (node.isNumber()) {
            return node.decimalValue();
        }
        if (node.isTextual()) {
            return node.textValue();
        }
        return node.asText();
    }

    static boolean isContainer(JsonNode node) {
        return node.isObject() || node.isArray();
    }
}
