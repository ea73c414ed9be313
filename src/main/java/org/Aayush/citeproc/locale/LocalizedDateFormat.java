package org.Aayush.citeproc.locale;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.Aayush.citeproc.style.DatePart;

import java.util.List;

/**
 * Localized {@code <date form="text|numeric">} definition.
 */
@Value
@Builder
public class LocalizedDateFormat {
    @Singular
    List<DatePart> parts;
    /** Delimiter between parts, nullable when parts carry their own affixes. */
    String delimiter;
}
