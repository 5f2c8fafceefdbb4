package com.mpl.domain.model;

import java.util.List;

/**
 * A stored case together with the warnings raised while producing it
 */
public record CaseResult(MaternityCase maternityCase, List<CaseWarning> warnings) {

    public CaseResult {
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public static CaseResult of(MaternityCase maternityCase) {
        return new CaseResult(maternityCase, List.of());
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }

    public boolean hasWarning(String code) {
        return warnings.stream().anyMatch(w -> w.code().equals(code));
    }
}
