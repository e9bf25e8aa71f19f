package com.eli5y.domain.formula.service;

import com.eli5y.domain.formula.model.FormulaDraft;

/**
 * Source of first-draft explanations for a formula.
 */
public interface DraftService {

    /**
     * Produce a one-sentence explanation of the formula plus the components the
     * explanation's phrases stand for. The result is not validated against the markup.
     *
     * @param latex the formula markup
     * @return the draft, already normalized to one shape
     */
    FormulaDraft draft(String latex);
}
