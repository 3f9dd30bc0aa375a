package datadog.matchers;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import datadog.matchers.MatchersConfig.EmptyCandidatesPolicy;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.junit.jupiter.api.Test;

class CandidatesTest {
  private static final MatchersConfig NEVER_MATCH =
      new MatchersConfig(EmptyCandidatesPolicy.NEVER_MATCH, 32);
  private static final MatchersConfig REJECT = new MatchersConfig(EmptyCandidatesPolicy.REJECT, 32);

  @Test
  void rendersInDeclaredOrderWithDuplicates() {
    Candidates<String> candidates = Candidates.of("happy", "birthday", "to", "you", "to");
    assertEquals("\"happy\", \"birthday\", \"to\", \"you\", \"to\"", candidates.render());
    assertEquals("(\"happy\", \"birthday\", \"to\", \"you\", \"to\")", candidates.toString());
    assertEquals(5, candidates.size());
  }

  @Test
  void rendersNonTextualCandidatesUnquoted() {
    assertEquals("1, 'c', null, 2.5", Candidates.<Object>of(1, 'c', null, 2.5).render());
  }

  @Test
  void isACopy() {
    List<String> source = new ArrayList<>(Arrays.asList("fee", "fie"));
    Candidates<String> candidates = Candidates.copyOf(source);
    source.add("foe");
    assertEquals(Arrays.asList("fee", "fie"), candidates.asList());
    assertThrows(UnsupportedOperationException.class, () -> candidates.asList().add("fum"));
  }

  @Test
  void emptyCandidatesAreRejectedByDefault() {
    assertThrows(InvalidMatcherException.class, () -> Candidates.of());
    assertThrows(
        InvalidMatcherException.class,
        () -> Candidates.copyOf(Collections.<String>emptyList(), REJECT));
  }

  @Test
  void nullCandidatesAreRejected() {
    assertThrows(InvalidMatcherException.class, () -> Candidates.of((String[]) null));
    assertThrows(InvalidMatcherException.class, () -> Candidates.copyOf(null, NEVER_MATCH));
  }

  @Test
  void emptyCandidatesNeverMatchWhenConfigured() {
    Candidates<String> none = Candidates.copyOf(Collections.<String>emptyList(), NEVER_MATCH);
    assertTrue(none.isEmpty());
    MatchOutcome outcome =
        ContainOneOf.evaluate(Container.of("fum"), none, Equalities.defaultEquality());
    assertFalse(outcome.matched());
    assertEquals("Some(\"fum\") did not contain one of ()", outcome.failureMessage());
  }

  @Test
  void equalsAndHashCode() {
    assertEquals(Candidates.of("a", "b"), Candidates.copyOf(Arrays.asList("a", "b")));
    assertEquals(
        Candidates.of("a", "b").hashCode(), Candidates.copyOf(Arrays.asList("a", "b")).hashCode());
  }
}
