package com.gbu.assessment.modules.generation;

import com.gbu.assessment.modules.question.OptionKey;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Random;
import java.util.Set;

/**
 * Small static skill to question catalog used to top up resume questions when
 * the AI service returns too few. Deliberately limited: a skill hint either
 * contains one of the catalog keywords or gets nothing.
 */
@Component
public class FallbackSkillQuestions {

    // Insertion order is match order: more specific keywords must come before
    // the keywords they contain (javascript before java, gitlab before git).
    private static final Map<String, Entry> CATALOG = new LinkedHashMap<>();

    static {
        add("javascript", "Which keyword declares a block-scoped variable in JavaScript?",
                "var", "let", "static", "global", OptionKey.B);
        add("typescript", "Which TypeScript feature adds static typing to variables?",
                "Decorators", "Type annotations", "Promises", "Closures", OptionKey.B);
        add("spring boot", "Which annotation marks the main Spring Boot application class?",
                "@SpringBootApplication", "@EnableSpring", "@SpringMain", "@SpringApp", OptionKey.A);
        add("java", "Which keyword is used to inherit a class in Java?",
                "implements", "extends", "inherits", "super", OptionKey.B);
        add("python", "Which Python data structure is mutable?",
                "tuple", "list", "str", "bytes", OptionKey.B);
        add("node.js", "Which Node.js module is used to create an HTTP server?",
                "http", "fs", "path", "net", OptionKey.A);
        add("react", "Which React hook manages component state in a function component?",
                "useMemo", "useState", "useRef", "useEffect", OptionKey.B);
        add("fastapi", "Which FastAPI decorator defines a GET endpoint?",
                "@app.get()", "@app.route()", "@app.fetch()", "@app.read()", OptionKey.A);
        add("django", "Which Django file defines database models?",
                "views.py", "models.py", "urls.py", "settings.py", OptionKey.B);
        add("flask", "Which object represents the Flask application instance?",
                "Flask(__name__)", "App()", "Server()", "FlaskApp()", OptionKey.A);
        add("nginx", "NGINX is primarily used as a:",
                "Relational database", "Reverse proxy and web server", "Message broker", "CI server", OptionKey.B);
        add("couchdb", "CouchDB stores data in which format?",
                "XML files", "JSON documents", "CSV tables", "Binary blobs only", OptionKey.B);
        add("prometheus", "Prometheus is primarily used for:",
                "Application monitoring and metrics", "Authentication", "Message queues", "Object storage",
                OptionKey.A);
        add("grafana", "Grafana is mainly used to:",
                "Run containers", "Visualize metrics and dashboards", "Compile code", "Manage databases",
                OptionKey.B);
        add("influxdb", "InfluxDB is best suited for storing:",
                "Time-series data", "Graph data", "Document data", "Key-value caches", OptionKey.A);
        add("bash", "Which symbol is used to reference a variable in Bash?",
                "&", "$", "#", "@", OptionKey.B);
        add("gitlab", "GitLab CI/CD pipelines are defined in which file?",
                ".gitlab-ci.yml", "Jenkinsfile", "pipeline.yml", ".gitlab.yml", OptionKey.A);
        add("github", "GitHub is primarily a platform for:",
                "Code hosting and collaboration", "Container orchestration", "Database hosting", "Monitoring",
                OptionKey.A);
        add("git", "Which Git command creates a new branch and switches to it?",
                "git branch new", "git switch -c new", "git checkout", "git init new", OptionKey.B);
        add("jenkins", "Which file defines a Jenkins pipeline as code?",
                "pipeline.yml", "Jenkinsfile", "jenkins.json", "build.gradle", OptionKey.B);
        add("docker", "Which file contains Docker build instructions?",
                "docker.yml", "Dockerfile", "compose.json", "build.cfg", OptionKey.B);
        add("kubernetes", "Which Kubernetes object ensures a desired number of pod replicas?",
                "Service", "Deployment", "ConfigMap", "Namespace", OptionKey.B);
        add("aws", "Which AWS service provides object storage?",
                "EC2", "S3", "RDS", "Lambda", OptionKey.B);
        add("azure", "Which Azure service provides object storage?",
                "Blob Storage", "Azure Functions", "Cosmos DB", "AKS", OptionKey.A);
        add("postgresql", "Which SQL clause filters results after GROUP BY?",
                "WHERE", "HAVING", "ORDER BY", "LIMIT", OptionKey.B);
        add("mysql", "Which command creates an index in MySQL?",
                "CREATE INDEX", "ADD INDEX", "MAKE INDEX", "INDEX CREATE", OptionKey.A);
        add("mongodb", "Which MongoDB method inserts a single document?",
                "insertMany()", "insertOne()", "add()", "create()", OptionKey.B);
        add("redis", "Which Redis command sets a key's value?",
                "GET", "SET", "PUT", "ADD", OptionKey.B);
        add("linux", "Which command lists files in a directory?",
                "ls", "pwd", "cat", "touch", OptionKey.A);
    }

    private final Random random;

    public FallbackSkillQuestions(Random random) {
        this.random = random;
    }

    /**
     * Builds up to {@code count} questions for the recognised skills, cycling
     * through them when there are fewer distinct matches than requested.
     *
     * @return empty when no hint matches a catalog keyword
     */
    public List<GeneratedQuestionCandidate> build(List<String> skillHints, int count) {
        if (skillHints == null || skillHints.isEmpty() || count <= 0) {
            return List.of();
        }
        Set<String> distinctHints = new LinkedHashSet<>();
        for (String hint : skillHints) {
            if (hint != null && !hint.isBlank()) {
                distinctHints.add(hint.trim().toLowerCase(Locale.ROOT));
            }
        }

        List<Entry> matched = new ArrayList<>();
        for (String hint : distinctHints) {
            for (Map.Entry<String, Entry> candidate : CATALOG.entrySet()) {
                if (hint.contains(candidate.getKey())) {
                    if (!matched.contains(candidate.getValue())) {
                        matched.add(candidate.getValue());
                    }
                    break;
                }
            }
        }
        if (matched.isEmpty()) {
            return List.of();
        }
        Collections.shuffle(matched, random);

        List<GeneratedQuestionCandidate> questions = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            Entry entry = matched.get(i % matched.size());
            questions.add(GeneratedQuestionCandidate.builder()
                    .questionText(entry.questionText())
                    .options(new EnumMap<>(entry.options()))
                    .correctOption(entry.correctOption())
                    .marks(1)
                    .skill(entry.skill())
                    .build());
        }
        return questions;
    }

    private static void add(String skill, String text, String a, String b, String c, String d, OptionKey correct) {
        Map<OptionKey, String> options = new EnumMap<>(OptionKey.class);
        options.put(OptionKey.A, a);
        options.put(OptionKey.B, b);
        options.put(OptionKey.C, c);
        options.put(OptionKey.D, d);
        CATALOG.put(skill, new Entry(skill, text, options, correct));
    }

    private record Entry(String skill, String questionText, Map<OptionKey, String> options, OptionKey correctOption) {
    }
}
