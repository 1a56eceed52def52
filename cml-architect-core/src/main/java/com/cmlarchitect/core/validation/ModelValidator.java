package com.cmlarchitect.core.validation;

import com.cmlarchitect.core.model.Aggregate;
import com.cmlarchitect.core.model.Attribute;
import com.cmlarchitect.core.model.BoundedContext;
import com.cmlarchitect.core.model.CmlModel;
import com.cmlarchitect.core.model.ContextMap;
import com.cmlarchitect.core.model.DomainModule;
import com.cmlarchitect.core.model.DomainObject;
import com.cmlarchitect.core.model.DomainService;
import com.cmlarchitect.core.model.Entity;
import com.cmlarchitect.core.model.Parameter;
import com.cmlarchitect.core.model.Relationship;
import com.cmlarchitect.core.model.ServiceOperation;
import com.cmlarchitect.core.model.SymmetricRelationship;
import com.cmlarchitect.core.model.UpstreamDownstreamRelationship;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Semantic rules over a {@link CmlModel}.
 *
 * <p>Validation is total: every rule runs and every finding is returned, so a caller can fix
 * all problems in one pass. Rules run in this order:
 * <ol>
 *   <li>bounded context names are unique</li>
 *   <li>per context: not empty (warning), aggregate names unique including modules</li>
 *   <li>per aggregate: entity and value object names unique, exactly one aggregate root</li>
 *   <li>domain object names unique across the whole model</li>
 *   <li>context map references resolve</li>
 *   <li>attribute, operation return and parameter types belong to the type grammar</li>
 *   <li>domain object names are not structurally reserved</li>
 * </ol>
 * A model with errors is still a usable value; deciding what to block is up to the caller.
 */
public class ModelValidator {

    private static final Logger log = LoggerFactory.getLogger(ModelValidator.class);

    /**
     * Validates a model.
     *
     * @param model model to check
     * @return all diagnostics; valid iff none is an error
     */
    public ValidationResult validate(CmlModel model) {
        Objects.requireNonNull(model, "model must not be null");

        List<Diagnostic> diagnostics = new ArrayList<>();
        List<AggregateLocation> locations = locateAggregates(model);

        checkBoundedContextNames(model, diagnostics);
        for (BoundedContext context : model.boundedContexts()) {
            checkBoundedContext(context, diagnostics);
        }
        for (AggregateLocation location : locations) {
            checkAggregate(location, diagnostics);
        }
        checkDomainObjectNames(locations, diagnostics);
        model.findContextMap().ifPresent(contextMap -> checkContextMap(model, contextMap, diagnostics));
        for (AggregateLocation location : locations) {
            checkTypes(location, diagnostics);
        }
        for (AggregateLocation location : locations) {
            checkReservedNames(location, diagnostics);
        }

        ValidationResult result = ValidationResult.of(diagnostics);
        log.debug("Validated model '{}': {} errors, {} warnings",
            model.name(), result.errors().size(), result.warnings().size());
        return result;
    }

    // Rule 1
    private void checkBoundedContextNames(CmlModel model, List<Diagnostic> diagnostics) {
        for (String name : duplicates(model.boundedContexts(), BoundedContext::name)) {
            diagnostics.add(Diagnostic.error("Duplicate bounded context name: " + name, name));
        }
    }

    // Rule 2
    private void checkBoundedContext(BoundedContext context, List<Diagnostic> diagnostics) {
        if (context.aggregates().isEmpty() && context.modules().isEmpty()) {
            diagnostics.add(Diagnostic.warning(
                "Bounded context '" + context.name() + "' has no aggregates or modules", context.name()));
        }
        for (String name : duplicates(context.allAggregates(), Aggregate::name)) {
            diagnostics.add(Diagnostic.error(
                "Duplicate aggregate name '" + name + "' in bounded context '" + context.name() + "'",
                context.name() + "." + name));
        }
    }

    // Rule 3
    private void checkAggregate(AggregateLocation location, List<Diagnostic> diagnostics) {
        Aggregate aggregate = location.aggregate();
        String where = "Aggregate '" + aggregate.name() + "' in '" + location.context().name() + "'";

        long roots = aggregate.entities().stream().filter(Entity::aggregateRoot).count();
        if (roots == 0 && !aggregate.entities().isEmpty()) {
            diagnostics.add(Diagnostic.warning(where + " has entities but no aggregate root defined", location.path()));
        } else if (roots > 1) {
            diagnostics.add(Diagnostic.error(where + " has multiple aggregate roots", location.path()));
        }

        for (String name : duplicates(aggregate.entities(), Entity::name)) {
            diagnostics.add(Diagnostic.error(
                "Duplicate entity name '" + name + "' in aggregate '" + aggregate.name() + "'",
                location.path() + "." + name));
        }
        for (String name : duplicates(aggregate.valueObjects(), DomainObject::name)) {
            diagnostics.add(Diagnostic.error(
                "Duplicate value object name '" + name + "' in aggregate '" + aggregate.name() + "'",
                location.path() + "." + name));
        }
    }

    // Rule 4
    private void checkDomainObjectNames(List<AggregateLocation> locations, List<Diagnostic> diagnostics) {
        Map<String, List<AggregateLocation>> index = new LinkedHashMap<>();
        for (AggregateLocation location : locations) {
            for (DomainObject object : location.aggregate().domainObjects()) {
                index.computeIfAbsent(object.name(), key -> new ArrayList<>()).add(location);
            }
        }

        index.forEach((name, found) -> {
            if (found.size() < 2) {
                return;
            }
            String paths = found.stream().map(AggregateLocation::path).collect(Collectors.joining(", "));
            String examples = found.stream()
                .map(location -> Identifiers.contextPrefix(location.context().name()) + name)
                .distinct()
                .limit(2)
                .map(candidate -> "'" + candidate + "'")
                .collect(Collectors.joining(", "));
            diagnostics.add(Diagnostic.error(
                "Ambiguous domain object name '" + name + "' defined in multiple locations: " + paths
                    + ". Use unique prefixed names (e.g., " + examples + ") to avoid ambiguous type references.",
                name));
        });
    }

    // Rule 5
    private void checkContextMap(CmlModel model, ContextMap contextMap, List<Diagnostic> diagnostics) {
        Set<String> known = model.boundedContexts().stream()
            .map(BoundedContext::name)
            .collect(Collectors.toSet());

        for (String name : contextMap.boundedContexts()) {
            if (!known.contains(name)) {
                diagnostics.add(Diagnostic.error(
                    "Context map references non-existent bounded context: " + name, contextMap.name()));
            }
        }
        for (Relationship relationship : contextMap.relationships()) {
            relationship.match(
                symmetric -> checkSymmetric(symmetric, known, diagnostics),
                upstreamDownstream -> checkUpstreamDownstream(model, upstreamDownstream, known, diagnostics)
            );
        }
    }

    private Void checkSymmetric(SymmetricRelationship relationship, Set<String> known, List<Diagnostic> diagnostics) {
        String location = relationship.participant1() + " [" + relationship.type().keyword() + "] "
            + relationship.participant2();
        for (String participant : new LinkedHashSet<>(relationship.participants())) {
            if (!known.contains(participant)) {
                diagnostics.add(Diagnostic.error(
                    "Relationship references non-existent bounded context: " + participant, location));
            }
        }
        if (relationship.participant1().equals(relationship.participant2())) {
            diagnostics.add(Diagnostic.warning(
                "Symmetric relationship between same context: " + relationship.participant1(), location));
        }
        return null;
    }

    private Void checkUpstreamDownstream(CmlModel model, UpstreamDownstreamRelationship relationship,
                                         Set<String> known, List<Diagnostic> diagnostics) {
        String location = relationship.upstream() + " -> " + relationship.downstream();
        if (!known.contains(relationship.upstream())) {
            diagnostics.add(Diagnostic.error(
                "Relationship references non-existent upstream context: " + relationship.upstream(), location));
        }
        if (!known.contains(relationship.downstream())) {
            diagnostics.add(Diagnostic.error(
                "Relationship references non-existent downstream context: " + relationship.downstream(), location));
        }
        if (relationship.upstream().equals(relationship.downstream())) {
            diagnostics.add(Diagnostic.error(
                "Upstream-downstream relationship cannot be between same context: " + relationship.upstream(),
                location));
        }
        model.findBoundedContext(relationship.upstream()).ifPresent(upstream -> {
            for (String exposed : relationship.exposedAggregates()) {
                if (upstream.findAggregate(exposed).isEmpty()) {
                    diagnostics.add(Diagnostic.warning(
                        "Exposed aggregate '" + exposed + "' does not exist in upstream context '"
                            + upstream.name() + "'", location));
                }
            }
        });
        return null;
    }

    // Rule 6
    private void checkTypes(AggregateLocation location, List<Diagnostic> diagnostics) {
        Aggregate aggregate = location.aggregate();
        for (DomainObject object : aggregate.domainObjects()) {
            String owner = object.kind().displayName() + " '" + object.name() + "'";
            String objectLocation = location.path() + "." + object.name();
            for (Attribute attribute : object.attributes()) {
                checkType(attribute.type(), "attribute '" + attribute.name() + "' of " + owner, objectLocation,
                    diagnostics);
            }
        }
        for (Entity entity : aggregate.entities()) {
            checkOperationTypes(entity.operations(), "Entity '" + entity.name() + "'",
                location.path() + "." + entity.name(), diagnostics);
        }
        for (DomainService service : aggregate.services()) {
            checkOperationTypes(service.operations(), "Service '" + service.name() + "'",
                location.path() + "." + service.name(), diagnostics);
        }
    }

    private void checkOperationTypes(List<ServiceOperation> operations, String owner, String location,
                                     List<Diagnostic> diagnostics) {
        for (ServiceOperation operation : operations) {
            String member = "operation '" + operation.name() + "' of " + owner;
            if (!ServiceOperation.VOID.equals(operation.returnType())) {
                checkType(operation.returnType(), "return type of " + member, location, diagnostics);
            }
            for (Parameter parameter : operation.parameters()) {
                checkType(parameter.type(), "parameter '" + parameter.name() + "' of " + member, location,
                    diagnostics);
            }
        }
    }

    private void checkType(String type, String subject, String location, List<Diagnostic> diagnostics) {
        TypeCheck check = AttributeTypeValidator.validateAttributeType(type);
        if (check.valid()) {
            return;
        }
        String message = "Invalid type for " + subject + ": " + check.error();
        if (check.suggestion() != null) {
            message += ". Suggestion: " + check.suggestion();
        }
        diagnostics.add(Diagnostic.error(message, location));
    }

    // Rule 7
    private void checkReservedNames(AggregateLocation location, List<Diagnostic> diagnostics) {
        Aggregate aggregate = location.aggregate();
        reserved(aggregate.name(), "Aggregate", location.path(), diagnostics);
        for (DomainObject object : aggregate.domainObjects()) {
            reserved(object.name(), object.kind().displayName(), location.path() + "." + object.name(), diagnostics);
        }
        for (DomainService service : aggregate.services()) {
            reserved(service.name(), "Service", location.path() + "." + service.name(), diagnostics);
        }
    }

    private void reserved(String name, String kind, String location, List<Diagnostic> diagnostics) {
        ReservedNameCheck check = ReservedNames.isReservedDomainObjectName(name);
        if (check.reserved()) {
            diagnostics.add(Diagnostic.error(
                "'" + name + "' is a reserved CML keyword and cannot be used as a " + kind
                    + " name. Try: " + check.suggestionText(), location));
        }
    }

    private static List<AggregateLocation> locateAggregates(CmlModel model) {
        List<AggregateLocation> locations = new ArrayList<>();
        for (BoundedContext context : model.boundedContexts()) {
            for (Aggregate aggregate : context.aggregates()) {
                locations.add(new AggregateLocation(context, null, aggregate));
            }
            for (DomainModule module : context.modules()) {
                for (Aggregate aggregate : module.aggregates()) {
                    locations.add(new AggregateLocation(context, module, aggregate));
                }
            }
        }
        return locations;
    }

    private static <T> List<String> duplicates(List<T> elements, Function<T, String> name) {
        Set<String> seen = new LinkedHashSet<>();
        Set<String> duplicated = new LinkedHashSet<>();
        for (T element : elements) {
            String elementName = name.apply(element);
            if (!seen.add(elementName)) {
                duplicated.add(elementName);
            }
        }
        return List.copyOf(duplicated);
    }

    private record AggregateLocation(BoundedContext context, DomainModule module, Aggregate aggregate) {
        String path() {
            return module == null
                ? context.name() + "." + aggregate.name()
                : context.name() + "." + module.name() + "." + aggregate.name();
        }
    }
}
