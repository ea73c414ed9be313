package org.Aayush.citeproc.reference;

import lombok.experimental.UtilityClass;

import java.util.List;
import java.util.Locale;

/**
 * Generated {@code citation-label} values for references that carry none: leading letters of up
 * to four family names plus the two-digit issued year ("Asth00", "RoNo78", "DEFG26").
 */
@UtilityClass
public class CitationLabel {
    public static final String VARIABLE = "citation-label";
    static final String NO_NAMES = "Xyz";

    /** Name variables consulted in order; the first non-empty one labels the reference. */
    private static final List<String> NAME_VARIABLES = List.of(
            "author", "editor", "translator", "collection-editor", "container-author",
            "director", "interviewer", "recipient", "reviewed-author", "composer");

    /** Particles sometimes left inside the family name; longer ones first. */
    private static final List<String> EMBEDDED_PARTICLES = List.of(
            "van de ", "van der ", "van den ", "van het ", "von der ", "von dem ", "von zu ",
            "auf den ", "in de ", "in 't ", "in het ", "uit de ", "uit den ", "op de ",
            "von ", "van ", "de ", "di ", "da ", "del ", "dela ", "della ", "dello ", "den ", "der ",
            "des ", "du ", "la ", "le ", "lo ", "les ", "ten ", "ter ", "te ", "auf ", "zum ", "zur ",
            "vom ", "am ", "el ", "al ", "il ", "dos ", "das ",
            "l'", "d'", "'t ");

    /**
     * Returns the reference's own label, or a generated one.
     */
    public String of(Reference reference) {
        String explicit = reference.variable(VARIABLE);
        return explicit != null ? explicit : generate(reference);
    }

    public String generate(Reference reference) {
        return namePart(reference) + yearPart(reference);
    }

    private String namePart(Reference reference) {
        List<Name> names = List.of();
        for (String variable : NAME_VARIABLES) {
            names = reference.names(variable);
            if (!names.isEmpty()) {
                break;
            }
        }
        if (names.isEmpty()) {
            return NO_NAMES;
        }
        int perName = names.size() == 1 ? 4 : names.size() <= 3 ? 2 : 1;
        StringBuilder label = new StringBuilder();
        for (Name name : names.subList(0, Math.min(4, names.size()))) {
            if (name.getFamily() == null) {
                continue;
            }
            String family = stripParticle(name.getFamily());
            label.append(family, 0, family.offsetByCodePoints(0, Math.min(perName, family.codePointCount(0, family.length()))));
        }
        return label.toString();
    }

    private String yearPart(Reference reference) {
        CslDate issued = reference.date("issued");
        DateParts start = issued == null ? null : issued.startParts();
        if (start == null || start.year() == null) {
            return "";
        }
        return String.format(Locale.ROOT, "%02d", Math.abs(start.year()) % 100);
    }

    private String stripParticle(String family) {
        String lower = family.toLowerCase(Locale.ROOT);
        for (String particle : EMBEDDED_PARTICLES) {
            if (lower.startsWith(particle)) {
                return family.substring(particle.length());
            }
        }
        return family;
    }
}
