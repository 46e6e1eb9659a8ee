package com.imapbox.session;

/**
 * One untagged data response of a command.
 * <p>
 * {@code text} is the response without the leading "* " and without the
 * command keyword, e.g. {@code 3 (UID 17 FLAGS (\Seen))} for FETCH or
 * {@code 4 9 12} for SEARCH. The first literal of the response, if any,
 * is split out into {@code literal}; its {@code {n}} marker stays in the text.
 */
public record ResponseRecord(String text, byte[] literal) {

    public static ResponseRecord of(String text) {
        return new ResponseRecord(text, null);
    }

    public boolean hasLiteral() {
        return literal != null;
    }
}
