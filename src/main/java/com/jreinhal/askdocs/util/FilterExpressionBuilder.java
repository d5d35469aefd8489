package com.jreinhal.askdocs.util;

/**
 * Builds portable Spring AI filter expressions over chunk metadata.
 */
public final class FilterExpressionBuilder {
    private static final String OWNER_TEMPLATE = "(owner == '%s' || owner == '%s')";
    private static final String DOCUMENT_TEMPLATE = "document_id == '%s'";

    private FilterExpressionBuilder() {
    }

    public static String forOwner(String owner, String sharedOwner) {
        if (owner == null || owner.isBlank()) {
            return "owner == '" + escapeValue(sharedOwner) + "'";
        }
        return String.format(OWNER_TEMPLATE, escapeValue(owner), escapeValue(sharedOwner));
    }

    public static String forOwnerAndDocument(String owner, String sharedOwner, String documentId) {
        String base = forOwner(owner, sharedOwner);
        if (documentId == null || documentId.isBlank()) {
            return base;
        }
        return and(base, String.format(DOCUMENT_TEMPLATE, escapeValue(documentId)));
    }

    public static String and(String left, String right) {
        String l = left == null ? "" : left.trim();
        String r = right == null ? "" : right.trim();
        if (l.isBlank()) {
            return r;
        }
        if (r.isBlank()) {
            return l;
        }
        return l + " && " + r;
    }

    private static String escapeValue(String value) {
        if (value == null) {
            return "";
        }
        // backslashes first, or an escaped quote could be unescaped again
        return value.replace("\\", "\\\\").replace("'", "\\'");
    }
}
