package org.Aayush.planning.automaton;

import it.unimi.dsi.fastutil.ints.IntRBTreeSet;
import it.unimi.dsi.fastutil.ints.IntSortedSet;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LTL Translator Tests")
class LtlTranslatorTest {

    @SafeVarargs
    private static List<Set<String>> word(Set<String>... letters) {
        return List.of(letters);
    }

    @Nested
    @DisplayName("1. Language Of Mission Formulas")
    class LanguageTests {

        @Test
        @DisplayName("Sequencing with avoidance: a before b, never c")
        void testSequenceWithAvoidance() {
            BuchiAutomaton automaton = LtlTranslator.translate("F (a && F b) && G !c");

            assertTrue(LassoChecker.accepts(automaton, word(Set.of(), Set.of("a"), Set.of(), Set.of("b")), word(Set.of())),
                    "visiting a and then b should satisfy the mission");
            assertTrue(LassoChecker.accepts(automaton, word(Set.of("a", "b")), word(Set.of())),
                    "a and b at the same position should satisfy F (a && F b)");
            assertFalse(LassoChecker.accepts(automaton, word(Set.of(), Set.of("b")), word(Set.of())),
                    "b without a must be rejected");
            assertFalse(LassoChecker.accepts(automaton, word(Set.of("a"), Set.of("c"), Set.of("b")), word(Set.of())),
                    "touching c must be rejected");
            assertFalse(LassoChecker.accepts(automaton, word(Set.of("a"), Set.of("b")), word(Set.of("c"))),
                    "c in the loop must be rejected");
        }

        @Test
        @DisplayName("Recurrence needs both regions in the loop")
        void testRecurrence() {
            BuchiAutomaton automaton = LtlTranslator.translate("G F a && G F b");

            assertTrue(LassoChecker.accepts(automaton, word(), word(Set.of("a"), Set.of("b"))));
            assertTrue(LassoChecker.accepts(automaton, word(Set.of(), Set.of()), word(Set.of("a"), Set.of(), Set.of("b"))));
            assertFalse(LassoChecker.accepts(automaton, word(Set.of("b")), word(Set.of("a"))),
                    "b only in the prefix must be rejected");
        }

        @Test
        @DisplayName("Until and next")
        void testUntilAndNext() {
            BuchiAutomaton until = LtlTranslator.translate("a U b");
            assertTrue(LassoChecker.accepts(until, word(Set.of("a"), Set.of("a"), Set.of("b")), word(Set.of())));
            assertTrue(LassoChecker.accepts(until, word(Set.of("b")), word(Set.of())));
            assertFalse(LassoChecker.accepts(until, word(Set.of("a"), Set.of()), word(Set.of("b"))));

            BuchiAutomaton next = LtlTranslator.translate("X a");
            assertTrue(LassoChecker.accepts(next, word(Set.of(), Set.of("a")), word(Set.of())));
            assertFalse(LassoChecker.accepts(next, word(Set.of("a"), Set.of()), word(Set.of())));
        }

        @Test
        @DisplayName("Implication, disjunction and weak until")
        void testDerivedOperators() {
            BuchiAutomaton response = LtlTranslator.translate("G (a -> F b)");
            assertTrue(LassoChecker.accepts(response, word(), word(Set.of())), "vacuous when a never holds");
            assertTrue(LassoChecker.accepts(response, word(Set.of("a")), word(Set.of("b"))));
            assertFalse(LassoChecker.accepts(response, word(Set.of("b")), word(Set.of("a"))));

            BuchiAutomaton either = LtlTranslator.translate("F a || F b");
            assertTrue(LassoChecker.accepts(either, word(Set.of("b")), word(Set.of())));
            assertFalse(LassoChecker.accepts(either, word(), word(Set.of("c"))));

            BuchiAutomaton weak = LtlTranslator.translate("a W b");
            assertTrue(LassoChecker.accepts(weak, word(), word(Set.of("a"))), "weak until allows a forever");
            assertFalse(LassoChecker.accepts(weak, word(Set.of("a")), word(Set.of())));
        }
    }

    @Nested
    @DisplayName("2. Automaton Contract")
    class ContractTests {

        @Test
        @DisplayName("Initial letter is read from INIT; violating letters have no successor")
        void testInitialLetter() {
            BuchiAutomaton automaton = LtlTranslator.translate("F (a && F b) && G !c");
            PropositionAlphabet alphabet = automaton.alphabet();

            assertFalse(automaton.successors(SpecificationAutomaton.INIT, alphabet.mask(Set.of())).isEmpty());
            assertTrue(automaton.successors(SpecificationAutomaton.INIT, alphabet.mask(Set.of("c"))).isEmpty(),
                    "starting inside c violates G !c");
            assertEquals(SpecificationAutomaton.REJECT,
                    automaton.step(SpecificationAutomaton.INIT, Set.of("c")));
        }

        @Test
        @DisplayName("Parking is accepted only after the mission is complete")
        void testConstantSuffix() {
            BuchiAutomaton automaton = LtlTranslator.translate("F (a && F b) && G !c");
            PropositionAlphabet alphabet = automaton.alphabet();
            long empty = alphabet.mask(Set.of());

            IntSortedSet states = new IntRBTreeSet();
            states.add(automaton.initialState());
            states = LassoChecker.advance(automaton, states, empty);
            for (int state : states) {
                assertFalse(automaton.acceptsConstantSuffix(state, empty), "parking before a is not accepted");
            }

            states = LassoChecker.advance(automaton, states, alphabet.mask(Set.of("a")));
            states = LassoChecker.advance(automaton, states, alphabet.mask(Set.of("b")));
            boolean parkingAccepted = false;
            for (int state : states) {
                parkingAccepted |= automaton.acceptsConstantSuffix(state, alphabet.mask(Set.of("b")));
            }
            assertTrue(parkingAccepted, "parking in b after a is accepted");
        }

        @Test
        @DisplayName("Recurrence is never accepted by standing still")
        void testRecurrenceNeedsMotion() {
            BuchiAutomaton automaton = LtlTranslator.translate("G F a && G F b");
            PropositionAlphabet alphabet = automaton.alphabet();
            for (int state = 0; state < automaton.stateCount(); state++) {
                assertFalse(automaton.acceptsConstantSuffix(state, alphabet.mask(Set.of("a"))));
                assertFalse(automaton.acceptsConstantSuffix(state, alphabet.mask(Set.of("b"))));
            }
            assertNotEquals(0L, automaton.positivePropositions(), "a and b are progress propositions");
        }

        @Test
        @DisplayName("Translation is reproducible")
        void testDeterministicNumbering() {
            String formula = "G F a && G F b && G !c";
            assertEquals(LtlTranslator.translate(formula).toString(), LtlTranslator.translate(formula).toString());
        }

        @Test
        @DisplayName("Unknown workspace labels still translate")
        void testUnknownLabels() {
            BuchiAutomaton automaton = LtlTranslator.translate("F z", List.of("a", "b"));
            assertTrue(automaton.alphabet().contains("z"));
        }
    }

    @Nested
    @DisplayName("3. Rejected Formulas")
    class RejectionTests {

        @ParameterizedTest
        @ValueSource(strings = {"a && !a", "G a && F !a", "false", "G F a && F G !a"})
        @DisplayName("Unsatisfiable formulas are rejected")
        void testUnsatisfiable(String formula) {
            FormulaException ex = assertThrows(FormulaException.class, () -> LtlTranslator.translate(formula));
            assertEquals(FormulaException.REASON_UNSATISFIABLE, ex.reasonCode());
        }

        @Test
        @DisplayName("More than 64 propositions are rejected")
        void testTooManyPropositions() {
            StringBuilder formula = new StringBuilder("p0");
            for (int i = 1; i <= PropositionAlphabet.MAX_PROPOSITIONS; i++) {
                formula.append(" || p").append(i);
            }
            FormulaException ex = assertThrows(FormulaException.class, () -> LtlTranslator.translate(formula.toString()));
            assertEquals(FormulaException.REASON_TOO_MANY_PROPOSITIONS, ex.reasonCode());
        }
    }
}
