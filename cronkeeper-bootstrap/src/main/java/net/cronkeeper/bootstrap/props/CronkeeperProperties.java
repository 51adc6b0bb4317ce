package net.cronkeeper.bootstrap.props;

import net.cronkeeper.core.service.ReconcilerConfig;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@ConfigurationProperties("cronkeeper")
public class CronkeeperProperties {
    private String zone = "UTC";
    private Owner owner = new Owner();
    private Annotation annotation = new Annotation();
    private Store store = new Store();
    private Loop loop = new Loop();
    private Catalog catalog = new Catalog();

    public String getZone() {
        return zone;
    }

    public void setZone(String zone) {
        this.zone = zone;
    }

    public Owner getOwner() {
        return owner;
    }

    public void setOwner(Owner owner) {
        this.owner = owner;
    }

    public Annotation getAnnotation() {
        return annotation;
    }

    public void setAnnotation(Annotation annotation) {
        this.annotation = annotation;
    }

    public Store getStore() {
        return store;
    }

    public void setStore(Store store) {
        this.store = store;
    }

    public Loop getLoop() {
        return loop;
    }

    public void setLoop(Loop loop) {
        this.loop = loop;
    }

    public Catalog getCatalog() {
        return catalog;
    }

    public void setCatalog(Catalog catalog) {
        this.catalog = catalog;
    }

    public static class Owner {
        private String kind = ReconcilerConfig.DEFAULT_OWNER_KIND;
        private String apiGroup = ReconcilerConfig.DEFAULT_API_GROUP;
        private String childKind = ReconcilerConfig.DEFAULT_CHILD_KIND;
        private String indexKey = ReconcilerConfig.DEFAULT_OWNER_INDEX_KEY;

        public String getKind() {
            return kind;
        }

        public void setKind(String kind) {
            this.kind = kind;
        }

        public String getApiGroup() {
            return apiGroup;
        }

        public void setApiGroup(String apiGroup) {
            this.apiGroup = apiGroup;
        }

        public String getChildKind() {
            return childKind;
        }

        public void setChildKind(String childKind) {
            this.childKind = childKind;
        }

        public String getIndexKey() {
            return indexKey;
        }

        public void setIndexKey(String indexKey) {
            this.indexKey = indexKey;
        }
    }

    public static class Annotation {
        private String scheduledAt = ReconcilerConfig.DEFAULT_SCHEDULED_AT_ANNOTATION;

        public String getScheduledAt() {
            return scheduledAt;
        }

        public void setScheduledAt(String scheduledAt) {
            this.scheduledAt = scheduledAt;
        }
    }

    public static class Store {
        private long queryTimeoutMs = 10000; // 스토어 빈은 이 키를 직접 읽는다

        public long getQueryTimeoutMs() {
            return queryTimeoutMs;
        }

        public void setQueryTimeoutMs(long queryTimeoutMs) {
            this.queryTimeoutMs = queryTimeoutMs;
        }
    }

    public static class Loop {
        private boolean enabled = true;
        private long tickDelayMs = 1000; // @Scheduled 는 이 키를 직접 읽는다
        private Duration backoffBase = Duration.ofSeconds(5);
        private Duration backoffMax = Duration.ofMinutes(5);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public long getTickDelayMs() {
            return tickDelayMs;
        }

        public void setTickDelayMs(long tickDelayMs) {
            this.tickDelayMs = tickDelayMs;
        }

        public Duration getBackoffBase() {
            return backoffBase;
        }

        public void setBackoffBase(Duration backoffBase) {
            this.backoffBase = backoffBase;
        }

        public Duration getBackoffMax() {
            return backoffMax;
        }

        public void setBackoffMax(Duration backoffMax) {
            this.backoffMax = backoffMax;
        }
    }

    public static class Catalog {
        private boolean enabled = true;
        private List<ScheduledJobDef> jobs = new ArrayList<>();

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public List<ScheduledJobDef> getJobs() {
            return jobs;
        }

        public void setJobs(List<ScheduledJobDef> jobs) {
            this.jobs = jobs;
        }
    }

    public static class ScheduledJobDef {
        private String namespace = "default";
        private String name;
        private String schedule;
        private Long startingDeadlineSeconds;
        private String concurrencyPolicy;
        private boolean suspend;
        private Integer successfulJobsHistoryLimit;
        private Integer failedJobsHistoryLimit;
        private TemplateDef template = new TemplateDef();

        public String getNamespace() {
            return namespace;
        }

        public void setNamespace(String namespace) {
            this.namespace = namespace;
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getSchedule() {
            return schedule;
        }

        public void setSchedule(String schedule) {
            this.schedule = schedule;
        }

        public Long getStartingDeadlineSeconds() {
            return startingDeadlineSeconds;
        }

        public void setStartingDeadlineSeconds(Long startingDeadlineSeconds) {
            this.startingDeadlineSeconds = startingDeadlineSeconds;
        }

        public String getConcurrencyPolicy() {
            return concurrencyPolicy;
        }

        public void setConcurrencyPolicy(String concurrencyPolicy) {
            this.concurrencyPolicy = concurrencyPolicy;
        }

        public boolean isSuspend() {
            return suspend;
        }

        public void setSuspend(boolean suspend) {
            this.suspend = suspend;
        }

        public Integer getSuccessfulJobsHistoryLimit() {
            return successfulJobsHistoryLimit;
        }

        public void setSuccessfulJobsHistoryLimit(Integer successfulJobsHistoryLimit) {
            this.successfulJobsHistoryLimit = successfulJobsHistoryLimit;
        }

        public Integer getFailedJobsHistoryLimit() {
            return failedJobsHistoryLimit;
        }

        public void setFailedJobsHistoryLimit(Integer failedJobsHistoryLimit) {
            this.failedJobsHistoryLimit = failedJobsHistoryLimit;
        }

        public TemplateDef getTemplate() {
            return template;
        }

        public void setTemplate(TemplateDef template) {
            this.template = template;
        }

        @Override
        public String toString() {
            return "ScheduledJobDef{" +
                    "namespace='" + namespace + '\'' +
                    ", name='" + name + '\'' +
                    ", schedule='" + schedule + '\'' +
                    ", concurrencyPolicy='" + concurrencyPolicy + '\'' +
                    ", suspend=" + suspend +
                    '}';
        }
    }

    public static class TemplateDef {
        private Map<String, String> labels = new LinkedHashMap<>();
        private Map<String, String> annotations = new LinkedHashMap<>();
        private String body;

        public Map<String, String> getLabels() {
            return labels;
        }

        public void setLabels(Map<String, String> labels) {
            this.labels = labels;
        }

        public Map<String, String> getAnnotations() {
            return annotations;
        }

        public void setAnnotations(Map<String, String> annotations) {
            this.annotations = annotations;
        }

        public String getBody() {
            return body;
        }

        public void setBody(String body) {
            this.body = body;
        }
    }
}
