package io.cdlengine.core.spec;

import static io.cdlengine.core.testkit.Json.json;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.cdlengine.core.engine.EngineLimits;
import io.cdlengine.core.engine.HaltChecker;
import io.cdlengine.core.engine.HaltViolation;
import io.cdlengine.core.error.ConstraintParseException;
import io.cdlengine.core.error.MalformedDurationException;
import io.cdlengine.core.error.NonTerminatingException;
import io.cdlengine.core.model.Action;
import io.cdlengine.core.model.AtomicConstraint;
import io.cdlengine.core.model.CompositeConstraint;
import io.cdlengine.core.model.ConditionalConstraint;
import io.cdlengine.core.model.Constraint;
import io.cdlengine.core.model.ConstraintDocument;
import io.cdlengine.core.model.Domain;
import io.cdlengine.core.model.Logic;
import io.cdlengine.core.model.Operator;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

@DisplayName("ConstraintParser")
class ConstraintParserTest {

    private final ConstraintParser parser = new ConstraintParser();

    @TempDir
    Path tempDir;

    @Nested
    class Atomic {

        @Test
        void parsesEveryAtomicKey() {
            Constraint constraint = parser.parse(json("""
                    {"domain": "financial", "field": "amount", "operator": "sum_lt", "value": 1000,
                     "message": "Daily limit", "action": "warn", "window": "24h", "group_by": "user"}
                    """));

            assertThat(constraint).isInstanceOf(AtomicConstraint.class);
            var atomic = (AtomicConstraint) constraint;
            assertThat(atomic.domain()).isEqualTo(Domain.FINANCIAL);
            assertThat(atomic.field()).isEqualTo("amount");
            assertThat(atomic.operator()).isEqualTo(Operator.SUM_LT);
            assertThat(atomic.value().intValue()).isEqualTo(1000);
            assertThat(atomic.message()).isEqualTo("Daily limit");
            assertThat(atomic.action()).isEqualTo(Action.WARN);
            assertThat(atomic.window()).isEqualTo("24h");
            assertThat(atomic.groupBy()).isEqualTo("user");
            assertThat(atomic.reference()).isNull();
        }

        @Test
        void sameDefinitionParsesToSameId() {
            String definition = "{\"domain\":\"financial\",\"field\":\"amount\",\"operator\":\"lt\",\"value\":1000}";

            assertThat(parser.parse(definition).id()).isEqualTo(parser.parse(definition).id());
            assertThat(parser.parse("{\"field\":\"amount\",\"operator\":\"lt\",\"value\":999}").id())
                    .isNotEqualTo(parser.parse(definition).id());
        }

        @Test
        void unknownKeyIsRejected() {
            assertThatThrownBy(() -> parser.parse(
                            json("{\"field\":\"amount\",\"operator\":\"sum_lt\",\"value\":1,\"groupby\":\"user\"}")))
                    .isInstanceOf(ConstraintParseException.class)
                    .hasMessageContaining("groupby")
                    .hasMessageContaining("at $");
        }

        @Test
        void unknownOperatorIsRejected() {
            assertThatThrownBy(() -> parser.parse("{\"field\":\"x\",\"operator\":\"approx\",\"value\":1}"))
                    .isInstanceOf(ConstraintParseException.class)
                    .hasMessageContaining("Unknown operator 'approx'");
        }

        @Test
        void unknownDomainAndActionAreRejected() {
            assertThatThrownBy(() -> parser.parse("{\"domain\":\"sports\",\"field\":\"x\",\"operator\":\"exists\"}"))
                    .isInstanceOf(ConstraintParseException.class)
                    .hasMessageContaining("sports");
            assertThatThrownBy(() -> parser.parse("{\"action\":\"panic\",\"field\":\"x\",\"operator\":\"exists\"}"))
                    .isInstanceOf(ConstraintParseException.class)
                    .hasMessageContaining("panic");
        }

        @Test
        void fieldAndOperatorAreRequired() {
            assertThatThrownBy(() -> parser.parse("{\"operator\":\"exists\"}"))
                    .isInstanceOf(ConstraintParseException.class)
                    .hasMessageContaining("'field'");
            assertThatThrownBy(() -> parser.parse("{\"field\":\"x\"}"))
                    .isInstanceOf(ConstraintParseException.class)
                    .hasMessageContaining("'operator'");
        }

        @Test
        void textKeysMustBeStrings() {
            assertThatThrownBy(() -> parser.parse("{\"field\":42,\"operator\":\"exists\"}"))
                    .isInstanceOf(ConstraintParseException.class)
                    .hasMessageContaining("must be a string");
        }

        @Test
        void malformedWindowIsReported() {
            assertThatThrownBy(() -> parser.parse(
                            "{\"field\":\"amount\",\"operator\":\"sum_lt\",\"value\":1,\"window\":\"24x\"}"))
                    .isInstanceOfSatisfying(MalformedDurationException.class, e -> {
                        assertThat(e.input()).isEqualTo("24x");
                        assertThat(e.getMessage()).contains("(at $)");
                    });
        }

        @Test
        void withinNeedsADurationValue() {
            assertThatThrownBy(() -> parser.parse("{\"field\":\"ts\",\"operator\":\"within\",\"value\":\"soon\"}"))
                    .isInstanceOf(MalformedDurationException.class);
        }
    }

    @Nested
    class Dispatch {

        @Test
        void ifKeyMakesAConditional() {
            Constraint constraint = parser.parse(json("""
                    {"if":   {"field": "type", "operator": "eq", "value": "wire"},
                     "then": {"field": "amount", "operator": "lt", "value": 1000}}
                    """));

            assertThat(constraint).isInstanceOf(ConditionalConstraint.class);
            assertThat(((ConditionalConstraint) constraint).hasElse()).isFalse();
        }

        @Test
        void logicKeyMakesAComposite() {
            Constraint constraint = parser.parse(json("""
                    {"logic": "OR", "constraints": [
                      {"field": "a", "operator": "exists"},
                      {"logic": "not", "constraints": [{"field": "b", "operator": "exists"}]}
                    ]}
                    """));

            assertThat(constraint).isInstanceOf(CompositeConstraint.class);
            var composite = (CompositeConstraint) constraint;
            assertThat(composite.logic()).isEqualTo(Logic.OR);
            assertThat(composite.children()).hasSize(2);
            assertThat(composite.children().get(1)).isInstanceOf(CompositeConstraint.class);
        }

        @Test
        void conditionalRequiresThen() {
            assertThatThrownBy(() -> parser.parse("{\"if\":{\"field\":\"a\",\"operator\":\"exists\"}}"))
                    .isInstanceOf(ConstraintParseException.class)
                    .hasMessageContaining("'then'");
        }

        @Test
        void compositeRequiresConstraintsArray() {
            assertThatThrownBy(() -> parser.parse("{\"logic\":\"and\"}"))
                    .isInstanceOf(ConstraintParseException.class)
                    .hasMessageContaining("'constraints' array");
        }

        @Test
        void unknownLogicIsRejected() {
            assertThatThrownBy(() -> parser.parse("{\"logic\":\"xor\",\"constraints\":[]}"))
                    .isInstanceOf(ConstraintParseException.class)
                    .hasMessageContaining("xor");
        }

        @Test
        void errorsNameTheNestedLocation() {
            assertThatThrownBy(() -> parser.parse(json("""
                            {"logic": "and", "constraints": [
                              {"field": "a", "operator": "exists"},
                              {"if": {"field": "b", "operator": "exists"}, "then": {"field": "c"}}
                            ]}
                            """)))
                    .isInstanceOf(ConstraintParseException.class)
                    .hasMessageContaining("$.constraints[1].then");
        }

        @Test
        void nonObjectDefinitionIsRejected() {
            assertThatThrownBy(() -> parser.parse("[1, 2]"))
                    .isInstanceOf(ConstraintParseException.class)
                    .hasMessageContaining("must be an object");
        }

        @Test
        void invalidJsonIsRejected() {
            assertThatThrownBy(() -> parser.parse("{not json"))
                    .isInstanceOf(ConstraintParseException.class)
                    .hasMessageContaining("Invalid JSON");
        }

        @Test
        void mapsAreAccepted() {
            Constraint constraint = parser.parse(Map.of(
                    "logic", "and", "constraints", List.of(Map.of("field", "amount", "operator", "lt", "value", 5))));

            assertThat(constraint).isInstanceOf(CompositeConstraint.class);
        }
    }

    @Nested
    class HaltChecking {

        @Test
        void unboundedAggregationIsRejected() {
            assertThatThrownBy(() -> parser.parse("{\"field\":\"amount\",\"operator\":\"sum_lt\",\"value\":100}"))
                    .isInstanceOfSatisfying(NonTerminatingException.class, e -> {
                        assertThat(e.violation()).isEqualTo(HaltViolation.UNBOUNDED_AGGREGATION);
                        assertThat(e.getMessage()).startsWith("Constraint may not terminate: ");
                    });
        }

        @Test
        void oversizedWindowIsRejected() {
            assertThatThrownBy(() -> parser.parse(
                            "{\"field\":\"amount\",\"operator\":\"sum_lt\",\"value\":100,\"window\":\"366d\"}"))
                    .isInstanceOf(NonTerminatingException.class);
        }

        @Test
        void deeplyNestedDefinitionIsRejectedWhileBuilding() {
            ObjectNode leaf = (ObjectNode) json("{\"field\":\"amount\",\"operator\":\"exists\"}");
            ObjectNode node = leaf;
            for (int i = 0; i < 10_000; i++) {
                ObjectNode wrapper = JsonNodeFactory.instance.objectNode();
                wrapper.set("if", leaf.deepCopy());
                wrapper.set("then", node);
                node = wrapper;
            }
            JsonNode deep = node;

            assertThatThrownBy(() -> parser.parse(deep))
                    .isInstanceOfSatisfying(NonTerminatingException.class, e -> {
                        assertThat(e.violation()).isEqualTo(HaltViolation.DEPTH_EXCEEDED);
                        assertThat(e.getMessage()).contains("Constraint depth exceeds maximum (100)");
                    });
        }

        @Test
        void deeplyNestedCompositeIsRejectedWhileBuilding() {
            ObjectNode node = (ObjectNode) json("{\"field\":\"amount\",\"operator\":\"exists\"}");
            for (int i = 0; i < 10_000; i++) {
                ObjectNode wrapper = JsonNodeFactory.instance.objectNode();
                wrapper.put("logic", "not");
                wrapper.putArray("constraints").add(node);
                node = wrapper;
            }
            JsonNode deep = node;

            assertThatThrownBy(() -> parser.parse(deep))
                    .isInstanceOfSatisfying(NonTerminatingException.class,
                            e -> assertThat(e.violation()).isEqualTo(HaltViolation.DEPTH_EXCEEDED));
        }

        @Test
        void nestingAtTheDepthLimitIsAccepted() {
            var shallow = new ConstraintParser(new HaltChecker(new EngineLimits(2, 100, 3600)));

            Constraint accepted = shallow.parse("{\"logic\":\"not\",\"constraints\":[{\"logic\":\"not\","
                    + "\"constraints\":[{\"field\":\"x\",\"operator\":\"exists\"}]}]}");

            assertThat(accepted).isInstanceOf(CompositeConstraint.class);
            assertThatThrownBy(() -> shallow.parse("{\"logic\":\"not\",\"constraints\":[{\"logic\":\"not\","
                            + "\"constraints\":[{\"logic\":\"not\",\"constraints\":"
                            + "[{\"field\":\"x\",\"operator\":\"exists\"}]}]}]}"))
                    .isInstanceOfSatisfying(NonTerminatingException.class,
                            e -> assertThat(e.violation()).isEqualTo(HaltViolation.DEPTH_EXCEEDED));
        }

        @Test
        void checkCanBeSkipped() {
            Constraint unchecked =
                    parser.parse(json("{\"field\":\"amount\",\"operator\":\"sum_lt\",\"value\":100}"), false);

            assertThat(unchecked).isInstanceOf(AtomicConstraint.class);
        }

        @Test
        void configuredLimitsApply() {
            var strict = new ConstraintParser(new HaltChecker(new EngineLimits(100, 2, 3600)));

            assertThatThrownBy(() -> strict.parse(
                            "{\"logic\":\"or\",\"constraints\":[{\"field\":\"a\",\"operator\":\"exists\"},"
                                    + "{\"field\":\"b\",\"operator\":\"exists\"},{\"field\":\"c\",\"operator\":\"exists\"}]}"))
                    .isInstanceOfSatisfying(
                            NonTerminatingException.class,
                            e -> assertThat(e.violation()).isEqualTo(HaltViolation.TOO_MANY_CHILDREN));
        }

        @Test
        void rejectionIsLoggedAtWarn() {
            Logger logger = (Logger) LoggerFactory.getLogger(ConstraintParser.class);
            ListAppender<ILoggingEvent> appender = new ListAppender<>();
            appender.start();
            logger.addAppender(appender);
            try {
                assertThatThrownBy(() -> parser.parse("{\"field\":\"amount\",\"operator\":\"count_gt\",\"value\":1}"))
                        .isInstanceOf(NonTerminatingException.class);

                assertThat(appender.list)
                        .anySatisfy(event -> {
                            assertThat(event.getLevel()).isEqualTo(Level.WARN);
                            assertThat(event.getFormattedMessage())
                                    .startsWith("constraint.rejected")
                                    .contains("violation=UNBOUNDED_AGGREGATION");
                        });
            } finally {
                logger.detachAppender(appender);
            }
        }
    }

    @Nested
    class FileInput {

        @Test
        void parsesYamlFile() throws IOException {
            Path file = tempDir.resolve("limit.yaml");
            Files.writeString(file, """
                    field: amount
                    operator: lt
                    value: 1000
                    """);

            Constraint constraint = parser.parse(file);

            assertThat(((AtomicConstraint) constraint).value().intValue()).isEqualTo(1000);
        }

        @Test
        void exceptionsCarryTheSourcePath() throws IOException {
            Path file = tempDir.resolve("broken.yaml");
            Files.writeString(file, """
                    field: amount
                    operator: lt
                    valu: 1000
                    """);

            assertThatThrownBy(() -> parser.parse(file))
                    .isInstanceOfSatisfying(
                            ConstraintParseException.class, e -> assertThat(e.source()).isEqualTo(file.toString()));
        }

        @Test
        void missingFileIsAParseError() {
            assertThatThrownBy(() -> parser.parse(tempDir.resolve("absent.yaml")))
                    .isInstanceOf(ConstraintParseException.class)
                    .hasMessageContaining("Failed to read");
        }

        @Test
        void parsesDocument() throws IOException {
            Path file = tempDir.resolve("payments.yaml");
            Files.writeString(file, """
                    id: payment-limits
                    version: "1.2"
                    description: Limits on outgoing payments
                    constraint:
                      logic: and
                      constraints:
                        - field: amount
                          operator: lt
                          value: 5000
                        - field: category
                          operator: ne
                          value: blocked
                    """);

            ConstraintDocument document = parser.parseDocument(file);

            assertThat(document.id()).isEqualTo("payment-limits");
            assertThat(document.version()).isEqualTo("1.2");
            assertThat(document.description()).isEqualTo("Limits on outgoing payments");
            assertThat(document.constraint()).isInstanceOf(CompositeConstraint.class);
        }

        @Test
        void documentRequiresIdAndConstraint() throws IOException {
            Path noId = tempDir.resolve("no-id.yaml");
            Files.writeString(noId, """
                    constraint:
                      field: a
                      operator: exists
                    """);
            Path noConstraint = tempDir.resolve("no-constraint.yaml");
            Files.writeString(noConstraint, "id: empty\n");

            assertThatThrownBy(() -> parser.parseDocument(noId))
                    .isInstanceOf(ConstraintParseException.class)
                    .hasMessageContaining("'id'");
            assertThatThrownBy(() -> parser.parseDocument(noConstraint))
                    .isInstanceOf(ConstraintParseException.class)
                    .hasMessageContaining("'constraint'");
        }

        @Test
        void documentRejectsUnknownRootKeys() throws IOException {
            Path file = tempDir.resolve("extra.yaml");
            Files.writeString(file, """
                    id: extra
                    owner: payments-team
                    constraint:
                      field: a
                      operator: exists
                    """);

            assertThatThrownBy(() -> parser.parseDocument(file))
                    .isInstanceOf(ConstraintParseException.class)
                    .hasMessageContaining("owner");
        }
    }
}
