package org.Aayush.citeproc.locale;

import lombok.Builder;
import lombok.Value;

/**
 * Outcome of resolving a requested locale tag against a {@link LocaleRegistry}.
 */
@Value
@Builder
public class LocaleResolution {
    /** Tag the caller asked for. */
    String requestedTag;
    /** Locale actually used. */
    CslLocale locale;
    /** True when the resolved locale is not an exact match for the requested tag. */
    boolean fallbackApplied;
}
