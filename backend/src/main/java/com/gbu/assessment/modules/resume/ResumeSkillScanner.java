package com.gbu.assessment.modules.resume;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Last-resort skill detection: plain keyword scan of the resume text, used
 * when the analysis service knows no skills for the student.
 */
@Component
public class ResumeSkillScanner {

    private static final List<String> COMMON_SKILLS = List.of(
            "Python", "Java", "C++", "C#", "JavaScript", "TypeScript", "React", "Node.js",
            "Express", "Django", "Flask", "FastAPI", "Spring", "Spring Boot", "SQL",
            "MySQL", "PostgreSQL", "MongoDB", "Redis", "Docker", "Kubernetes", "AWS",
            "Azure", "GCP", "HTML", "CSS", "Git", "Linux", "Pandas", "NumPy",
            "TensorFlow", "PyTorch", "Scikit-learn", "Power BI", "Tableau",
            "Excel", "REST", "GraphQL");

    public List<String> scan(String resumeText) {
        if (resumeText == null || resumeText.isBlank()) {
            return List.of();
        }
        String normalized = resumeText.toLowerCase(Locale.ROOT);
        List<String> found = new ArrayList<>();
        for (String skill : COMMON_SKILLS) {
            if (normalized.contains(skill.toLowerCase(Locale.ROOT))) {
                found.add(skill);
            }
        }
        return found;
    }
}
