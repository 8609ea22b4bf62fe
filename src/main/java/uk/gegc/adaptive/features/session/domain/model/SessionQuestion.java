package uk.gegc.adaptive.features.session.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import uk.gegc.adaptive.features.category.domain.model.Category;
import uk.gegc.adaptive.features.question.domain.model.Question;

import java.util.UUID;

@Entity
@Getter
@Setter
@NoArgsConstructor
@Table(name = "session_questions",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_session_questions_position", columnNames = {"session_id", "position"}),
                @UniqueConstraint(name = "uk_session_questions_question", columnNames = {"session_id", "question_id"})
        }
)
public class SessionQuestion {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "session_question_id", nullable = false, updatable = false)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "session_id", referencedColumnName = "session_id", nullable = false, updatable = false)
    private QuizSession session;

    @Column(name = "position", nullable = false, updatable = false)
    private int position;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "question_id", referencedColumnName = "question_id", nullable = false, updatable = false)
    private Question question;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "category_id", referencedColumnName = "category_id", nullable = false, updatable = false)
    private Category category;

    // frozen so later rating moves do not change what the learner was scored against
    @Column(name = "question_rating_at_selection", nullable = false, updatable = false)
    private int questionRatingAtSelection;
}
