package com.gbu.assessment.modules.question;

import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

import static com.gbu.assessment.modules.question.AptitudeQuestionSpecifications.*;

@Service
@RequiredArgsConstructor
public class JpaQuestionBank implements QuestionBank {

    private final AptitudeQuestionRepository questionRepository;

    @Override
    @Transactional(readOnly = true)
    public List<AptitudeQuestion> listApproved(AptitudeCategory category, DifficultyLevel difficulty,
            Collection<UUID> excludeIds, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        Specification<AptitudeQuestion> spec = Specification.where(servable())
                .and(inCategory(category))
                .and(withDifficulty(difficulty))
                .and(excludingIds(excludeIds));
        return questionRepository.findAll(spec, PageRequest.of(0, limit)).getContent();
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<AptitudeQuestion> getById(UUID id) {
        return questionRepository.findById(id);
    }

    @Override
    @Transactional(readOnly = true)
    public Map<UUID, AptitudeQuestion> getAllById(Collection<UUID> ids) {
        if (ids.isEmpty()) {
            return Map.of();
        }
        return questionRepository.findAllById(ids).stream()
                .collect(Collectors.toMap(AptitudeQuestion::getId, q -> q));
    }
}
