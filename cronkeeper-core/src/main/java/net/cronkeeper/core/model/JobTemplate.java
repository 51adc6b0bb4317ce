package net.cronkeeper.core.model;

import java.util.Map;

/**
 * 자식 Job 생성용 템플릿.
 * body 는 외부 실행기가 해석하는 불투명 페이로드다. 코어는 복사만 한다.
 */
public record JobTemplate(Map<String, String> labels, Map<String, String> annotations, String body) {
    public JobTemplate {
        labels = labels == null ? Map.of() : Map.copyOf(labels);
        annotations = annotations == null ? Map.of() : Map.copyOf(annotations);
    }

    public static JobTemplate empty() {
        return new JobTemplate(Map.of(), Map.of(), null);
    }
}
