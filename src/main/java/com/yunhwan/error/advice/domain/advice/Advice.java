package com.yunhwan.error.advice.domain.advice;

/**
 * AI가 만든 디버깅 제안.
 *
 * @param summary         원인 요약
 * @param suggestedAction 권장 조치
 * @param model           advice를 만든 모델 (stub 포함)
 */
public record Advice(
        String summary,
        String suggestedAction,
        String model
) {

    public Advice {
        summary = summary == null ? "" : summary;
        suggestedAction = suggestedAction == null ? "" : suggestedAction;
        model = model == null ? "unknown" : model;
    }

    public int size() {
        return summary.length() + suggestedAction.length() + model.length();
    }

    /**
     * summary/suggestedAction 합이 maxChars를 넘지 않도록 자른다. model은 유지.
     */
    public Advice truncatedTo(int maxChars) {
        if (maxChars <= 0 || size() <= maxChars) {
            return this;
        }
        int budget = Math.max(0, maxChars - model.length());
        String s = summary.length() <= budget ? summary : summary.substring(0, budget);
        int rest = budget - s.length();
        String a = suggestedAction.length() <= rest ? suggestedAction : suggestedAction.substring(0, rest);
        return new Advice(s, a, model);
    }
}
