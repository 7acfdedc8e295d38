package com.thinkfast.infrastructure;

import com.thinkfast.application.port.QuestionGenerator;
import com.thinkfast.domain.Difficulty;
import com.thinkfast.domain.Operations;
import com.thinkfast.domain.Question;
import com.thinkfast.domain.Settings;
import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.random.RandomGenerator;
import org.springframework.stereotype.Service;

/**
 * Random arithmetic questions.
 *
 * <p>Operands are drawn from 1..{@link Difficulty#maxOperand()}. Division questions are built
 * backwards from the quotient so they always divide evenly. Exponent questions use small bases
 * and powers that grow with difficulty. Only operations enabled in the settings are used; with
 * none enabled, addition is used.
 */
@Service
public class ArithmeticQuestionGenerator implements QuestionGenerator {
  private final RandomGenerator rnd;

  public ArithmeticQuestionGenerator() {
    this(new SecureRandom());
  }

  ArithmeticQuestionGenerator(RandomGenerator rnd) {
    this.rnd = Objects.requireNonNull(rnd);
  }

  @Override
  public List<Question> generate(Settings settings) {
    List<Op> ops = enabled(settings.operations());
    List<Question> out = new ArrayList<>(settings.questionCount());
    for (int i = 0; i < settings.questionCount(); i++) {
      Op op = ops.get(rnd.nextInt(ops.size()));
      out.add(question(i + 1, op, settings.difficulty()));
    }
    return out;
  }

  private Question question(int id, Op op, Difficulty d) {
    int max = d.maxOperand();
    int a = between(1, max);
    int b = between(1, max);
    switch (op) {
      case ADD:
        return build(id, op, a, b, a + b);
      case SUBTRACT:
        return build(id, op, a, b, a - b);
      case MULTIPLY:
        return build(id, op, a, b, a * b);
      case DIVIDE:
        // a is the quotient
        return build(id, op, a * b, b, a);
      case POWER: {
        int base = between(2, maxBase(d));
        int exp = between(2, maxExponent(d));
        return build(id, op, base, exp, (int) Math.pow(base, exp));
      }
      default:
        throw new IllegalArgumentException("Unsupported operation " + op);
    }
  }

  private static Question build(int id, Op op, int left, int right, int answer) {
    return new Question(id, left + " " + op.symbol + " " + right, answer, op.symbol);
  }

  private int between(int lo, int hi) {
    return rnd.nextInt(lo, hi + 1);
  }

  private static int maxBase(Difficulty d) {
    switch (d) {
      case EASY:
        return 5;
      case MEDIUM:
        return 10;
      default:
        return 12;
    }
  }

  private static int maxExponent(Difficulty d) {
    switch (d) {
      case EASY:
        return 2;
      case MEDIUM:
        return 3;
      default:
        return 4;
    }
  }

  private static List<Op> enabled(Operations o) {
    List<Op> ops = new ArrayList<>();
    if (o.addition()) ops.add(Op.ADD);
    if (o.subtraction()) ops.add(Op.SUBTRACT);
    if (o.multiplication()) ops.add(Op.MULTIPLY);
    if (o.division()) ops.add(Op.DIVIDE);
    if (o.exponents()) ops.add(Op.POWER);
    if (ops.isEmpty()) ops.add(Op.ADD);
    return ops;
  }

  private enum Op {
    ADD("+"),
    SUBTRACT("-"),
    MULTIPLY("*"),
    DIVIDE("/"),
    POWER("^");

    private final String symbol;

    Op(String symbol) {
      this.symbol = symbol;
    }
  }
}
