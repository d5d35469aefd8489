package com.jreinhal.askdocs.retrieval;

import java.util.Locale;

public enum RetrievalMethod {
    DENSE,
    LEXICAL;

    public String tag() {
        return this.name().toLowerCase(Locale.ROOT);
    }
}
