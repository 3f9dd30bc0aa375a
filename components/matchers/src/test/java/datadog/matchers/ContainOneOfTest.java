package datadog.matchers;

import static datadog.matchers.StringNormalizations.lowerCased;
import static datadog.matchers.StringNormalizations.trimmed;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoMoreInteractions;
import static org.mockito.Mockito.when;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

class ContainOneOfTest {
  private static final Container<String> FUM_SOME = Container.of("fum");
  private static final Container<String> TO_SOME = Container.of("to");
  private static final Equality<String> INVERTED = (a, b) -> !a.equals(b);

  @Test
  void presentValueAmongCandidatesMatches() {
    MatchOutcome outcome =
        ContainOneOf.evaluate(
            FUM_SOME, Candidates.of("fee", "fie", "foe", "fum"), Equalities.defaultEquality());
    assertTrue(outcome.matched());
    assertTrue(outcome.succeeded());
    assertEquals(Polarity.POSITIVE, outcome.polarity());
  }

  @Test
  void presentValueNotAmongCandidatesDoesNotMatch() {
    MatchOutcome outcome =
        ContainOneOf.evaluate(
            FUM_SOME,
            Candidates.of("happy", "birthday", "to", "you"),
            Equalities.defaultEquality());
    assertFalse(outcome.matched());
    assertFalse(outcome.succeeded());
    assertEquals(
        "Some(\"fum\") did not contain one of (\"happy\", \"birthday\", \"to\", \"you\")",
        outcome.failureMessage());
  }

  @Test
  void negatedAssertionSucceedsWhenNothingMatches() {
    MatchOutcome outcome =
        ContainOneOf.evaluate(
            TO_SOME,
            Candidates.of("fee", "fie", "foe", "fum"),
            Equalities.defaultEquality(),
            Polarity.NEGATED);
    assertFalse(outcome.matched());
    assertTrue(outcome.negated());
    assertTrue(outcome.succeeded());
  }

  @Test
  void negatedAssertionFailsWhenSomethingMatches() {
    MatchOutcome outcome =
        ContainOneOf.evaluate(
            TO_SOME,
            Candidates.of("happy", "birthday", "to", "you"),
            Equalities.defaultEquality(),
            Polarity.NEGATED);
    assertTrue(outcome.matched());
    assertFalse(outcome.succeeded());
    assertEquals(
        "Some(\"to\") contained one of (\"happy\", \"birthday\", \"to\", \"you\")",
        outcome.failureMessage());
  }

  @Test
  void customEqualityOverridesDefault() {
    Candidates<String> candidates = Candidates.of("happy", "birthday", "to", "you");
    assertFalse(
        ContainOneOf.evaluate(FUM_SOME, candidates, Equalities.defaultEquality()).matched());
    assertTrue(ContainOneOf.evaluate(FUM_SOME, candidates, INVERTED).matched());

    Candidates<String> fums = Candidates.of("fum", "fum", "fum", "fum");
    assertTrue(ContainOneOf.evaluate(FUM_SOME, fums, Equalities.defaultEquality()).matched());
    assertFalse(ContainOneOf.evaluate(FUM_SOME, fums, INVERTED).matched());
  }

  @Test
  void normalizedEqualityMatchesWhereDefaultDoesNot() {
    Candidates<String> shouting = Candidates.of(" FEE ", " FIE ", " FOE ", " FUM ");
    assertFalse(
        ContainOneOf.evaluate(FUM_SOME, shouting, Equalities.defaultEquality()).matched());
    assertTrue(
        ContainOneOf.evaluate(FUM_SOME, shouting, Equalities.afterBeing(lowerCased(), trimmed()))
            .matched());
  }

  @Test
  void emptyContainerNeverConsultsEquality() {
    @SuppressWarnings("unchecked")
    Equality<String> equality = mock(Equality.class);
    when(equality.areEqual(any(), any())).thenReturn(true);

    MatchOutcome outcome =
        ContainOneOf.evaluate(Container.<String>empty(), Candidates.of("fee", "fum"), equality);

    assertFalse(outcome.matched());
    assertEquals("None", outcome.containerRepr());
    assertEquals("None did not contain one of (\"fee\", \"fum\")", outcome.failureMessage());
    verify(equality, never()).areEqual(any(), any());
  }

  @Test
  void scanStopsAtFirstAcceptedCandidate() {
    @SuppressWarnings("unchecked")
    Equality<String> equality = mock(Equality.class);
    when(equality.areEqual("fum", "fie")).thenReturn(true);

    assertTrue(
        ContainOneOf.evaluate(FUM_SOME, Candidates.of("fee", "fie", "foe", "fum"), equality)
            .matched());

    verify(equality).areEqual("fum", "fee");
    verify(equality).areEqual("fum", "fie");
    verifyNoMoreInteractions(equality);
  }

  @Test
  void everyCandidateIsTriedWhenNothingMatches() {
    @SuppressWarnings("unchecked")
    Equality<String> equality = mock(Equality.class);

    assertFalse(
        ContainOneOf.evaluate(FUM_SOME, Candidates.of("a", "b", "a"), equality).matched());

    verify(equality, times(2)).areEqual(eq("fum"), eq("a"));
    verify(equality).areEqual(eq("fum"), eq("b"));
  }

  @Test
  void equalityExceptionsPropagate() {
    IllegalStateException failure = new IllegalStateException("broken equality");
    Equality<String> throwing =
        (a, b) -> {
          throw failure;
        };
    IllegalStateException thrown =
        assertThrows(
            IllegalStateException.class,
            () -> ContainOneOf.evaluate(FUM_SOME, Candidates.of("fum"), throwing));
    assertSame(failure, thrown);
  }

  @Test
  void positiveAndNegatedAreComplements() {
    for (Candidates<String> candidates :
        Arrays.asList(Candidates.of("fum"), Candidates.of("fee", "fie"))) {
      MatchOutcome positive =
          ContainOneOf.evaluate(FUM_SOME, candidates, Equalities.defaultEquality());
      MatchOutcome negated =
          ContainOneOf.evaluate(
              FUM_SOME, candidates, Equalities.defaultEquality(), Polarity.NEGATED);
      assertEquals(positive.matched(), negated.matched());
      assertEquals(positive.succeeded(), !negated.succeeded());
      assertEquals(negated.succeeded(), positive.negate().succeeded());
    }
  }

  static Stream<Arguments> permutations() {
    List<String> base = Arrays.asList("fee", "fie", "foe", "fum");
    Stream.Builder<Arguments> builder = Stream.builder();
    for (int shift = 0; shift < base.size(); shift++) {
      List<String> rotated = new ArrayList<>(base);
      Collections.rotate(rotated, shift);
      builder.add(Arguments.of(rotated, "fum", true));
      builder.add(Arguments.of(rotated, "to", false));
      List<String> reversed = new ArrayList<>(rotated);
      Collections.reverse(reversed);
      builder.add(Arguments.of(reversed, "fee", true));
    }
    return builder.build();
  }

  @ParameterizedTest
  @MethodSource("permutations")
  void candidateOrderDoesNotChangeResult(List<String> candidates, String value, boolean expected) {
    assertEquals(
        expected,
        ContainOneOf.evaluate(
                Container.of(value), Candidates.copyOf(candidates), Equalities.defaultEquality())
            .matched());
  }

  @Test
  void nonTextualValuesAreRenderedUnquoted() {
    MatchOutcome outcome =
        ContainOneOf.evaluate(Container.of(2), Candidates.of(1, 3), Equalities.defaultEquality());
    assertEquals("Some(2) did not contain one of (1, 3)", outcome.failureMessage());
  }

  @Test
  void nullArgumentsAreRejected() {
    Candidates<String> candidates = Candidates.of("fum");
    assertThrows(
        NullPointerException.class,
        () -> ContainOneOf.evaluate(null, candidates, Equalities.defaultEquality()));
    assertThrows(
        NullPointerException.class,
        () -> ContainOneOf.evaluate(FUM_SOME, null, Equalities.defaultEquality()));
    assertThrows(
        NullPointerException.class, () -> ContainOneOf.evaluate(FUM_SOME, candidates, null));
  }
}
