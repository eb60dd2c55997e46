package io.storyforge.core.spec;

import static org.assertj.core.api.Assertions.assertThat;

import io.storyforge.core.model.ModifierCall;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("PatternRecognizer")
class PatternRecognizerTest {

    @Nested
    @DisplayName("rule references")
    class RuleReferences {

        @Test
        void bareRule() {
            Fragment f = PatternRecognizer.recognize("#animal#");

            assertThat(f.production()).isEqualTo(Production.ONLY_RULE);
            assertThat(f.ruleName()).isEqualTo("animal");
            assertThat(f.modifiers()).isEmpty();
        }

        @Test
        void ruleWithModifiers() {
            Fragment f = PatternRecognizer.recognize("#verb.a.ed.replace(a,b)#");

            assertThat(f.production()).isEqualTo(Production.ONLY_RULE);
            assertThat(f.ruleName()).isEqualTo("verb");
            assertThat(f.modifiers()).containsExactly("a", "ed", "replace(a,b)");
        }

        @Test
        void ruleWithLeadingActionsSplitsIntoActionsAndBareRule() {
            Fragment f = PatternRecognizer.recognize("#[hero:#name#][job:pirate]story.capitalize#");

            assertThat(f.production()).isEqualTo(Production.ONLY_RULE_WITH_ACTIONS);
            assertThat(f.parts()).containsExactly("[hero:#name#][job:pirate]", "#story.capitalize#");
        }

        @ParameterizedTest
        @ValueSource(strings = {"#", "##", "#a", "# spaced#", "#a..b#", "#a.#", "#[unclosed#"})
        void malformedReferencesAreLiteral(String text) {
            assertThat(PatternRecognizer.recognize(text).production()).isEqualTo(Production.LITERAL);
            assertThat(PatternRecognizer.isComplete(text)).isTrue();
        }
    }

    @Nested
    @DisplayName("actions")
    class Actions {

        @Test
        void keylessRuleAction() {
            Fragment f = PatternRecognizer.recognize("[#setPronouns#]");

            assertThat(f.production()).isEqualTo(Production.KEYLESS_RULE_ACTION);
            assertThat(f.parts()).containsExactly("#setPronouns#");
        }

        @Test
        void keyWithRuleAction() {
            Fragment f = PatternRecognizer.recognize("[hero:#name.capitalize#]");

            assertThat(f.production()).isEqualTo(Production.KEY_WITH_RULE_ACTION);
            assertThat(f.key()).isEqualTo("hero");
            assertThat(f.parts()).containsExactly("#name.capitalize#");
        }

        @Test
        void keyWithTextActionSplitsOnCommas() {
            Fragment f = PatternRecognizer.recognize("[pet:cat,dog]");

            assertThat(f.production()).isEqualTo(Production.KEY_WITH_TEXT_ACTION);
            assertThat(f.key()).isEqualTo("pet");
            assertThat(f.parts()).containsExactly("cat", "dog");
        }

        @Test
        void emptyTextActionHasNoTokens() {
            Fragment f = PatternRecognizer.recognize("[pet:]");

            assertThat(f.production()).isEqualTo(Production.KEY_WITH_TEXT_ACTION);
            assertThat(f.parts()).isEmpty();
        }

        @Test
        void consecutiveActions() {
            Fragment f = PatternRecognizer.recognize("[a:1][#b#][c:#d#]");

            assertThat(f.production()).isEqualTo(Production.ONLY_ACTIONS);
            assertThat(f.parts()).containsExactly("[a:1]", "[#b#]", "[c:#d#]");
        }

        @Test
        void unrecognizedBracketGroupStaysLiteralText() {
            Fragment f = PatternRecognizer.recognize("[a:1][not an action]");

            assertThat(f.production()).isEqualTo(Production.MIXED_TEXT);
            assertThat(f.parts()).containsExactly("[a:1]", "[not an action]");
            assertThat(PatternRecognizer.isComplete("[not an action]")).isTrue();
        }
    }

    @Nested
    @DisplayName("mixed text")
    class MixedText {

        @Test
        void segmentsAlternateLiteralAndRules() {
            Fragment f = PatternRecognizer.recognize("the #animal# ate #food.a#!");

            assertThat(f.production()).isEqualTo(Production.MIXED_TEXT);
            assertThat(f.parts()).containsExactly("the ", "#animal#", " ate ", "#food.a#", "!");
        }

        @Test
        void adjacentRulesHaveNoEmptySegments() {
            assertThat(PatternRecognizer.splitSegments("#a##b#")).containsExactly("#a#", "#b#");
        }

        @Test
        void rulesWithActionsAreSingleSegments() {
            assertThat(PatternRecognizer.splitSegments("#[k:#x#]a# and #[k:y]b#"))
                    .containsExactly("#[k:#x#]a#", " and ", "#[k:y]b#");
        }

        @Test
        void containsExpandableIsUnanchored() {
            assertThat(PatternRecognizer.containsExpandable("xx #a# yy")).isTrue();
            assertThat(PatternRecognizer.containsExpandable("xx [k:v] yy")).isTrue();
            assertThat(PatternRecognizer.containsExpandable("xx # [yy]")).isFalse();
        }

        @Test
        void inlineActionsAreSingleSegments() {
            Fragment f = PatternRecognizer.recognize("[hero:#name#] met #friend#");

            assertThat(f.production()).isEqualTo(Production.MIXED_TEXT);
            assertThat(f.parts()).containsExactly("[hero:#name#]", " met ", "#friend#");
        }

        @Test
        void referencesInsideUnrecognizedBracketsAreSplitOut() {
            assertThat(PatternRecognizer.splitSegments("[see #ref#]")).containsExactly("[see ", "#ref#", "]");
        }

        @Test
        void plainTextIsLiteral() {
            assertThat(PatternRecognizer.recognize("just words").production()).isEqualTo(Production.LITERAL);
            assertThat(PatternRecognizer.recognize("").production()).isEqualTo(Production.LITERAL);
        }
    }

    @Nested
    @DisplayName("modifier tokens")
    class ModifierTokens {

        @Test
        void plainToken() {
            assertThat(PatternRecognizer.parseModifier("capitalize")).isEqualTo(ModifierCall.of("capitalize"));
        }

        @Test
        void emptyParenthesesMeanNoParameters() {
            ModifierCall call = PatternRecognizer.parseModifier("eris()");

            assertThat(call.name()).isEqualTo("eris");
            assertThat(call.params()).isEmpty();
            assertThat(call.token()).isEqualTo("eris()");
        }

        @Test
        void parametersSplitOnCommas() {
            ModifierCall call = PatternRecognizer.parseModifier("eris(output,no2,,yes)");

            assertThat(call.name()).isEqualTo("eris");
            assertThat(call.params()).containsExactly("output", "no2", "", "yes");
        }

        @Test
        void parametersKeepSpaces() {
            assertThat(PatternRecognizer.parseModifier("eris(hail eris)").params()).containsExactly("hail eris");
        }
    }
}
