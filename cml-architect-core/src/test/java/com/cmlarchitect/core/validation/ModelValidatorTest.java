package com.cmlarchitect.core.validation;

import com.cmlarchitect.core.model.Aggregate;
import com.cmlarchitect.core.model.Attribute;
import com.cmlarchitect.core.model.BoundedContext;
import com.cmlarchitect.core.model.CmlModel;
import com.cmlarchitect.core.model.Entity;
import com.cmlarchitect.core.model.ValueObject;
import com.cmlarchitect.core.parser.CmlModelParser;
import com.cmlarchitect.core.parser.ParseResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ModelValidator}.
 */
class ModelValidatorTest {

    private ModelValidator validator;

    @BeforeEach
    void setUp() {
        validator = new ModelValidator();
    }

    private static CmlModel parse(String text) {
        ParseResult result = CmlModelParser.parse(text);
        assertThat(result.errors()).isEmpty();
        return result.model();
    }

    @Test
    void validate_wellFormedModel_isValidWithoutDiagnostics() {
        CmlModel model = parse("""
            ContextMap {
                contains Sales, Billing
                Sales [U,OHS] -> [D,ACL] Billing {
                    exposedAggregates = Orders
                }
            }
            BoundedContext Sales {
                Aggregate Orders {
                    Entity Order {
                        aggregateRoot
                        - OrderId orderId key
                        String status
                    }
                    ValueObject OrderId { String value }
                }
            }
            BoundedContext Billing {
                Aggregate Invoices {
                    Entity Invoice { aggregateRoot }
                }
            }
            """);

        ValidationResult result = validator.validate(model);

        assertThat(result.valid()).isTrue();
        assertThat(result.diagnostics()).isEmpty();
    }

    @Test
    void validate_sameValueObjectInTwoContexts_reportsOneErrorListingBothLocations() {
        CmlModel model = parse("""
            BoundedContext A2AServer {
                Aggregate Agents { ValueObject AgentId { String value } }
            }
            BoundedContext DatabricksPlatform {
                Module registry {
                    Aggregate Registry { ValueObject AgentId { String value } }
                }
            }
            """);

        ValidationResult result = validator.validate(model);

        assertThat(result.valid()).isFalse();
        List<Diagnostic> agentIdErrors = result.errors().stream()
            .filter(d -> d.message().contains("'AgentId'"))
            .toList();
        assertThat(agentIdErrors).hasSize(1);
        Diagnostic error = agentIdErrors.get(0);
        assertThat(error.message())
            .contains("A2AServer.Agents")
            .contains("DatabricksPlatform.registry.Registry")
            .contains("'A2AAgentId'")
            .contains("'DatabricksAgentId'");
        assertThat(error.location()).isEqualTo("AgentId");
    }

    @Test
    void validate_sameNameAcrossKinds_isAmbiguous() {
        CmlModel model = parse("""
            BoundedContext Sales {
                Aggregate Orders {
                    Entity Order { aggregateRoot }
                }
                Aggregate History {
                    DomainEvent Order
                }
            }
            """);

        ValidationResult result = validator.validate(model);

        assertThat(result.errors()).singleElement()
            .satisfies(d -> assertThat(d.message()).startsWith("Ambiguous domain object name 'Order'"));
    }

    @Test
    void validate_twoAggregateRoots_reportsExactlyOneError() {
        CmlModel model = parse("""
            BoundedContext Sales {
                Aggregate Orders {
                    Entity Order { aggregateRoot }
                    Entity Cart { aggregateRoot }
                }
            }
            """);

        ValidationResult result = validator.validate(model);

        assertThat(result.valid()).isFalse();
        assertThat(result.errors()).hasSize(1);
        assertThat(result.errors().get(0).message()).contains("multiple aggregate roots");
        assertThat(result.errors().get(0).location()).isEqualTo("Sales.Orders");
        assertThat(result.warnings()).isEmpty();
    }

    @Test
    void validate_entitiesWithoutRoot_reportsExactlyOneWarning() {
        CmlModel model = parse("""
            BoundedContext Sales {
                Aggregate Orders {
                    Entity Order
                    Entity Cart
                }
            }
            """);

        ValidationResult result = validator.validate(model);

        assertThat(result.valid()).isTrue();
        assertThat(result.errors()).isEmpty();
        assertThat(result.warnings()).hasSize(1);
        assertThat(result.warnings().get(0).message())
            .isEqualTo("Aggregate 'Orders' in 'Sales' has entities but no aggregate root defined");
    }

    @Test
    void validate_emptyBoundedContext_isWarning() {
        ValidationResult result = validator.validate(parse("BoundedContext Empty { }"));

        assertThat(result.valid()).isTrue();
        assertThat(result.warnings()).extracting(Diagnostic::message)
            .containsExactly("Bounded context 'Empty' has no aggregates or modules");
    }

    @Test
    void validate_duplicateBoundedContexts_reportsOneErrorPerName() {
        CmlModel model = parse("""
            BoundedContext Sales { Aggregate A1 { } }
            BoundedContext Sales { Aggregate A2 { } }
            BoundedContext Sales { Aggregate A3 { } }
            """);

        ValidationResult result = validator.validate(model);

        assertThat(result.errors()).extracting(Diagnostic::message)
            .containsExactly("Duplicate bounded context name: Sales");
    }

    @Test
    void validate_duplicateAggregateInModule_isError() {
        CmlModel model = parse("""
            BoundedContext Sales {
                Aggregate Orders { }
                Module archive {
                    Aggregate Orders { }
                }
            }
            """);

        ValidationResult result = validator.validate(model);

        assertThat(result.errors()).extracting(Diagnostic::message)
            .containsExactly("Duplicate aggregate name 'Orders' in bounded context 'Sales'");
    }

    @Test
    void validate_duplicateEntityAndValueObjectNamesInAggregate_areErrors() {
        Aggregate aggregate = new Aggregate("agg", "Orders", List.of(), null,
            List.of(new Entity("e1", "Order", true, List.of(), List.of()),
                new Entity("e2", "Order", false, List.of(), List.of())),
            List.of(new ValueObject("v1", "Money", List.of()), new ValueObject("v2", "Money", List.of())),
            List.of(), List.of(), List.of());
        CmlModel model = new CmlModel("Test", null,
            List.of(BoundedContext.named("bc", "Sales").withAggregate(aggregate)));

        ValidationResult result = validator.validate(model);

        assertThat(result.errors()).extracting(Diagnostic::message).contains(
            "Duplicate entity name 'Order' in aggregate 'Orders'",
            "Duplicate value object name 'Money' in aggregate 'Orders'");
    }

    @Test
    void validate_unresolvedContextMapReferences_areErrors() {
        CmlModel model = parse("""
            ContextMap {
                contains Sales, Ghost
                Sales -> Phantom
                Sales Partnership Nowhere
            }
            BoundedContext Sales { Aggregate Orders { } }
            """);

        ValidationResult result = validator.validate(model);

        assertThat(result.errors()).extracting(Diagnostic::message).containsExactly(
            "Context map references non-existent bounded context: Ghost",
            "Relationship references non-existent downstream context: Phantom",
            "Relationship references non-existent bounded context: Nowhere");
    }

    @Test
    void validate_selfRelationships_symmetricWarnsAndUpstreamDownstreamFails() {
        CmlModel model = parse("""
            ContextMap {
                Sales Partnership Sales
                Sales -> Sales
            }
            BoundedContext Sales { Aggregate Orders { } }
            """);

        ValidationResult result = validator.validate(model);

        assertThat(result.warnings()).extracting(Diagnostic::message)
            .containsExactly("Symmetric relationship between same context: Sales");
        assertThat(result.errors()).extracting(Diagnostic::message)
            .containsExactly("Upstream-downstream relationship cannot be between same context: Sales");
    }

    @Test
    void validate_exposedAggregateMissingUpstream_isWarning() {
        CmlModel model = parse("""
            ContextMap {
                Sales -> Billing { exposedAggregates = Orders, Returns }
            }
            BoundedContext Sales { Aggregate Orders { } }
            BoundedContext Billing { Aggregate Invoices { } }
            """);

        ValidationResult result = validator.validate(model);

        assertThat(result.valid()).isTrue();
        assertThat(result.warnings()).extracting(Diagnostic::message)
            .containsExactly("Exposed aggregate 'Returns' does not exist in upstream context 'Sales'");
    }

    @Test
    void validate_invalidAttributeType_isError() {
        ValueObject settings = new ValueObject("v", "Settings",
            List.of(Attribute.of("values", "Map<String, Any>")));
        Aggregate aggregate = Aggregate.named("a", "Config").withValueObject(settings);
        CmlModel model = new CmlModel("Test", null,
            List.of(BoundedContext.named("bc", "Platform").withAggregate(aggregate)));

        ValidationResult result = validator.validate(model);

        assertThat(result.errors()).singleElement().satisfies(d -> {
            assertThat(d.message()).contains("'values'").contains("Value Object 'Settings'").contains("Map types");
            assertThat(d.location()).isEqualTo("Platform.Config.Settings");
        });
    }

    @Test
    void validate_invalidOperationTypes_areErrors() {
        CmlModel model = parse("""
            BoundedContext Platform {
                Aggregate Jobs {
                    Entity Task {
                        aggregateRoot
                        String title
                        def Any go(Dynamic d)
                    }
                    Service Runner {
                        def Callback run(String name)
                        def void stop()
                    }
                }
            }
            """);

        ValidationResult result = validator.validate(model);

        assertThat(result.valid()).isFalse();
        assertThat(result.errors()).extracting(Diagnostic::message).containsExactly(
            "Invalid type for return type of operation 'go' of Entity 'Task': "
                + "Type 'Any' is not supported in CML. Suggestion: String",
            "Invalid type for parameter 'd' of operation 'go' of Entity 'Task': "
                + "Type 'Dynamic' is not supported in CML. Suggestion: String",
            "Invalid type for return type of operation 'run' of Service 'Runner': "
                + "Type 'Callback' is not supported in CML. Suggestion: String");
        assertThat(result.errors()).extracting(Diagnostic::location)
            .containsExactly("Platform.Jobs.Task", "Platform.Jobs.Task", "Platform.Jobs.Runner");
    }

    @Test
    void validate_referencesToOwnValueObjectsNamedLikeLibraryTypes_areValid() {
        CmlModel model = parse("""
            BoundedContext Planning {
                Aggregate Tasks {
                    Entity Task {
                        aggregateRoot
                        - Action nextAction
                        Record audit
                        def Result complete(- Action action)
                    }
                    ValueObject Action { String label }
                    ValueObject Record { String entry }
                    ValueObject Result { boolean done }
                }
            }
            """);

        ValidationResult result = validator.validate(model);

        assertThat(result.valid()).isTrue();
        assertThat(result.diagnostics()).isEmpty();
    }

    @Test
    void validate_reservedDomainObjectName_isError() {
        CmlModel model = parse("""
            BoundedContext Platform {
                Aggregate Resources {
                    Entity Resource { aggregateRoot }
                }
            }
            """);

        ValidationResult result = validator.validate(model);

        assertThat(result.errors()).singleElement()
            .satisfies(d -> assertThat(d.message()).startsWith("'Resource' is a reserved CML keyword"));
    }

    @Test
    void validate_diagnosticsFollowRuleOrder() {
        CmlModel model = parse("""
            ContextMap { contains Ghost }
            BoundedContext Empty { }
            BoundedContext Sales {
                Aggregate Orders { Entity Order }
            }
            """);

        ValidationResult result = validator.validate(model);

        assertThat(result.diagnostics()).extracting(Diagnostic::message).containsExactly(
            "Bounded context 'Empty' has no aggregates or modules",
            "Aggregate 'Orders' in 'Sales' has entities but no aggregate root defined",
            "Context map references non-existent bounded context: Ghost");
    }
}
