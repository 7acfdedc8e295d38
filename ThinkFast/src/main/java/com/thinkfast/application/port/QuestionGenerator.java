package com.thinkfast.application.port;

import com.thinkfast.domain.Question;
import com.thinkfast.domain.Settings;
import java.util.List;

public interface QuestionGenerator {
  /** Produce {@code settings.questionCount()} questions with ids 1..n. */
  List<Question> generate(Settings settings);
}
