package com.ilograph.edit.ref;

/**
 * One path component of a reference expression.
 *
 * @param token      component text with any surrounding {@code [...]} removed
 * @param raw        component text as written
 * @param relative   the owning segment started with {@code ../} or {@code .../}
 * @param wildcard   contains {@code *} and is not special
 * @param namespaced contains {@code ::}
 * @param special    one of {@code *}, {@code none}, {@code ^} (case-insensitive)
 */
public record ReferenceComponent(String token, String raw, boolean relative, boolean wildcard,
        boolean namespaced, boolean special) {

    /** Namespace prefix of a namespaced token, or null. */
    public String namespace() {
        int idx = token.indexOf("::");
        return idx < 0 ? null : token.substring(0, idx);
    }

    /** True for tokens that name a concrete target and can be looked up. */
    public boolean isPlain() {
        return !special && !wildcard;
    }
}
