package org.Aayush.citeproc.reference;

import lombok.Builder;
import lombok.Value;

/**
 * One personal or institutional name from a name variable.
 *
 * <p>Literal names (institutions, collectives) carry only {@code literal} and render verbatim.</p>
 */
@Value
@Builder(toBuilder = true)
public class Name {
    /** Family name without particles. */
    String family;
    /** Given names, possibly already initialized. */
    String given;
    /** Particle dropped when the name is inverted without the given name ("van" in some styles). */
    String droppingParticle;
    /** Particle kept with the family name ("de" in "de Gaulle"). */
    String nonDroppingParticle;
    /** Generational suffix ("Jr."). */
    String suffix;
    /** Verbatim name, used instead of the parts when present. */
    String literal;
    /** True when the suffix is joined with a comma ("Smith, Jr."). */
    boolean commaSuffix;
    /** True when the given name must never be reordered. */
    boolean staticOrdering;

    /**
     * Creates a personal name from family and given parts.
     */
    public static Name of(String family, String given) {
        return Name.builder().family(family).given(given).build();
    }

    /**
     * Creates a literal (institutional) name.
     */
    public static Name literal(String literal) {
        return Name.builder().literal(literal).build();
    }

    /**
     * Returns true when this name renders verbatim.
     */
    public boolean isLiteral() {
        return literal != null && !literal.isBlank();
    }

    /**
     * Returns the family name prefixed with the non-dropping particle, or the literal.
     */
    public String familyWithParticle() {
        if (isLiteral()) {
            return literal;
        }
        String base = family == null ? "" : family;
        if (nonDroppingParticle == null || nonDroppingParticle.isBlank()) {
            return base;
        }
        return joinParticle(nonDroppingParticle, base);
    }

    /**
     * Stable key used to attach per-name disambiguation hints.
     */
    public String hintKey() {
        if (isLiteral()) {
            return literal;
        }
        return familyWithParticle() + "|" + (given == null ? "" : given);
    }

    /**
     * Joins a particle to a family name; apostrophe and hyphen particles attach without a space.
     */
    public static String joinParticle(String particle, String family) {
        if (particle.endsWith("'") || particle.endsWith("’") || particle.endsWith("-")) {
            return particle + family;
        }
        return particle + " " + family;
    }
}
