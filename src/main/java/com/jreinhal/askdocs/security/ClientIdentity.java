package com.jreinhal.askdocs.security;

/**
 * Identity a request is rate limited under.
 */
public record ClientIdentity(String value, Source source) {

    public enum Source {
        SESSION_HEADER,
        SESSION_COOKIE,
        CLIENT_IP
    }

    /**
     * Store key fragment; the source prefix keeps a session id from colliding with an address.
     */
    public String key() {
        return (this.source == Source.CLIENT_IP ? "ip:" : "session:") + this.value;
    }
}
