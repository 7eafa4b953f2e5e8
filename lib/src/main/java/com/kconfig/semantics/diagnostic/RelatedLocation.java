package com.kconfig.semantics.diagnostic;

import com.kconfig.semantics.model.SourceRange;

/** Secondary location attached to a diagnostic, such as the declaration a message refers to. */
public record RelatedLocation(SourceRange location, String message) {}
