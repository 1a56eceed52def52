package com.cmlarchitect.core.workspace;

import com.cmlarchitect.core.model.Aggregate;
import com.cmlarchitect.core.model.Attribute;
import com.cmlarchitect.core.model.BoundedContext;
import com.cmlarchitect.core.model.CmlModel;
import com.cmlarchitect.core.model.Command;
import com.cmlarchitect.core.model.ContextMap;
import com.cmlarchitect.core.model.ContextMapState;
import com.cmlarchitect.core.model.DomainEvent;
import com.cmlarchitect.core.model.DomainModule;
import com.cmlarchitect.core.model.DomainObject;
import com.cmlarchitect.core.model.DomainService;
import com.cmlarchitect.core.model.Entity;
import com.cmlarchitect.core.model.KnowledgeLevel;
import com.cmlarchitect.core.model.Parameter;
import com.cmlarchitect.core.model.Relationship;
import com.cmlarchitect.core.model.ServiceOperation;
import com.cmlarchitect.core.model.ValueObject;
import com.cmlarchitect.core.parser.CmlModelParser;
import com.cmlarchitect.core.parser.ParseResult;
import com.cmlarchitect.core.util.IdGenerator;
import com.cmlarchitect.core.validation.AttributeTypeValidator;
import com.cmlarchitect.core.validation.Identifiers;
import com.cmlarchitect.core.validation.ModelValidator;
import com.cmlarchitect.core.validation.ReservedNameCheck;
import com.cmlarchitect.core.validation.ReservedNames;
import com.cmlarchitect.core.validation.TypeCheck;
import com.cmlarchitect.core.validation.ValidationResult;
import com.cmlarchitect.core.writer.CmlWriter;
import com.cmlarchitect.core.writer.WriterConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * An editing session over one {@link CmlModel}.
 *
 * <p>The workspace holds the current model and applies mutations to it. Every mutation is
 * checked before anything changes: names are sanitized, reserved names are rejected, domain
 * object names must be unique across the whole model, and attribute types must belong to the
 * CML type grammar. A rejected mutation leaves the model untouched and reports why, usually
 * with a suggestion.
 *
 * <p>Models are immutable, so {@link #current()} hands out a snapshot that later mutations do
 * not affect. The workspace itself is not thread-safe; callers allow at most one mutation in
 * flight.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * ModelWorkspace workspace = new ModelWorkspace();
 * workspace.createBoundedContext("Sales");
 * workspace.createAggregate("Sales", "Orders");
 * MutationResult result = workspace.addEntity("Sales", "Orders",
 *     new EntitySpec("Order", true, List.of(Attribute.of("status", "String"))));
 * String cml = workspace.serialize();
 * }</pre>
 */
public class ModelWorkspace {

    private static final Logger log = LoggerFactory.getLogger(ModelWorkspace.class);

    private static final Pattern COLLECTION_TYPE = Pattern.compile("^(List|Set)\\s*<\\s*(\\w+)\\s*>$");
    private static final Pattern REFERENCE_TYPE = Pattern.compile("^-\\s*(\\w+)$");
    private static final String IDENTIFIER_SUFFIX = "Id";

    private final ModelValidator validator = new ModelValidator();
    private CmlModel model;

    /**
     * Creates a workspace holding an empty model.
     */
    public ModelWorkspace() {
        this(CmlModel.empty(CmlModel.DEFAULT_NAME));
    }

    /**
     * Creates a workspace holding the given model.
     *
     * @param model initial model
     */
    public ModelWorkspace(CmlModel model) {
        this.model = Objects.requireNonNull(model, "model must not be null");
    }

    /**
     * Parses a document and, if it has no errors, makes it the current model.
     *
     * @param text CML source
     * @return parse result; on failure the current model is kept
     */
    public ParseResult load(String text) {
        ParseResult result = CmlModelParser.parse(text);
        if (result.success()) {
            model = result.model();
            log.debug("Loaded model with {} bounded context(s)", model.boundedContexts().size());
        }
        return result;
    }

    public CmlModel current() {
        return model;
    }

    public ValidationResult validate() {
        return validator.validate(model);
    }

    public String serialize() {
        return serialize(WriterConfig.defaults());
    }

    public String serialize(WriterConfig config) {
        return new CmlWriter(config).serialize(model);
    }

    /**
     * Adds an empty bounded context.
     *
     * @param rawName context name, sanitized before use
     * @return id of the new context, or the reason it was rejected
     */
    public MutationResult createBoundedContext(String rawName) {
        String name = Identifiers.sanitize(rawName);
        if (model.findBoundedContext(name).isPresent()) {
            return MutationResult.rejected("Bounded context '" + name + "' already exists");
        }
        BoundedContext context = BoundedContext.named(IdGenerator.newId(), name);
        model = model.withBoundedContext(context);
        return MutationResult.created(context.id());
    }

    public MutationResult createAggregate(String contextName, String rawName) {
        return createAggregate(contextName, rawName, List.of(), null, null);
    }

    /**
     * Adds an empty aggregate to a bounded context, optionally inside a module.
     *
     * @param contextName owning bounded context
     * @param rawName aggregate name, sanitized before use
     * @param responsibilities responsibility statements
     * @param knowledgeLevel knowledge level, may be {@code null}
     * @param moduleName module to place the aggregate in, created if missing; {@code null}
     *                   places the aggregate directly in the context
     * @return id of the new aggregate, or the reason it was rejected
     */
    public MutationResult createAggregate(String contextName, String rawName, List<String> responsibilities,
                                          KnowledgeLevel knowledgeLevel, String moduleName) {
        Optional<BoundedContext> found = model.findBoundedContext(contextName);
        if (found.isEmpty()) {
            return MutationResult.rejected("Bounded context '" + contextName + "' not found");
        }
        BoundedContext context = found.get();
        String name = Identifiers.sanitize(rawName);

        ReservedNameCheck reserved = ReservedNames.isReservedDomainObjectName(name);
        if (reserved.reserved()) {
            return MutationResult.rejected(reservedMessage(name, "Aggregate"), "Try: " + reserved.suggestionText());
        }
        if (context.findAggregate(name).isPresent()) {
            return MutationResult.rejected(
                "Aggregate '" + name + "' already exists in bounded context '" + contextName + "'");
        }

        Aggregate aggregate = new Aggregate(IdGenerator.newId(), name, responsibilities, knowledgeLevel,
            List.of(), List.of(), List.of(), List.of(), List.of());
        BoundedContext updated;
        if (moduleName == null) {
            updated = context.withAggregate(aggregate);
        } else {
            String module = Identifiers.sanitize(moduleName);
            DomainModule target = context.findModule(module)
                .orElseGet(() -> new DomainModule(IdGenerator.newId(), module, List.of()));
            updated = context.withModule(target.withAggregate(aggregate));
        }
        model = model.replaceBoundedContext(updated);
        return MutationResult.created(aggregate.id());
    }

    public MutationResult addEntity(String contextName, String aggregateName, EntitySpec spec) {
        return addSingle(contextName, aggregateName, ElementType.ENTITY, spec.name(), spec.aggregateRoot(),
            spec.attributes(), List.of());
    }

    public MutationResult addValueObject(String contextName, String aggregateName, ElementSpec spec) {
        return addSingle(contextName, aggregateName, ElementType.VALUE_OBJECT, spec.name(), false,
            spec.attributes(), List.of());
    }

    public MutationResult addDomainEvent(String contextName, String aggregateName, ElementSpec spec) {
        return addSingle(contextName, aggregateName, ElementType.DOMAIN_EVENT, spec.name(), false,
            spec.attributes(), List.of());
    }

    public MutationResult addCommand(String contextName, String aggregateName, ElementSpec spec) {
        return addSingle(contextName, aggregateName, ElementType.COMMAND, spec.name(), false,
            spec.attributes(), List.of());
    }

    public MutationResult addService(String contextName, String aggregateName, ServiceSpec spec) {
        return addSingle(contextName, aggregateName, ElementType.SERVICE, spec.name(), false,
            List.of(), spec.operations());
    }

    /**
     * Adds a relationship to the context map, creating the map if the model has none.
     *
     * @param relationship relationship between existing bounded contexts
     * @return id of the relationship, or the reason it was rejected
     */
    public MutationResult addRelationship(Relationship relationship) {
        Objects.requireNonNull(relationship, "relationship must not be null");
        for (String participant : relationship.participants()) {
            if (model.findBoundedContext(participant).isEmpty()) {
                return MutationResult.rejected("Bounded context '" + participant + "' not found",
                    "Create the bounded context before relating it");
            }
        }
        String selfReference = relationship.match(
            symmetric -> null,
            upstreamDownstream -> upstreamDownstream.upstream().equals(upstreamDownstream.downstream())
                ? upstreamDownstream.upstream()
                : null
        );
        if (selfReference != null) {
            return MutationResult.rejected(
                "Upstream-downstream relationship cannot be between same context: " + selfReference);
        }

        ContextMap contextMap = model.findContextMap()
            .orElseGet(() -> new ContextMap(IdGenerator.newId(), ContextMap.DEFAULT_NAME, null,
                ContextMapState.AS_IS, List.of(), List.of()));
        model = model.withContextMap(contextMap.withRelationship(relationship));
        return MutationResult.created(relationship.id());
    }

    /**
     * Adds several elements to one aggregate as a single step.
     *
     * <p>Every element is checked first, including name clashes inside the batch. Only when all
     * checks pass is the model changed; otherwise nothing is added. With {@code failFast} the
     * checks stop at the first rejected element, without it every rejected element is reported.
     *
     * <p>Identifiers whose value object already exists in the aggregate are reused, not rejected.
     *
     * @param request elements to add
     * @param failFast stop checking at the first rejection
     * @return created elements, or every rejection found
     */
    public BatchResult batchAddElements(BatchRequest request, boolean failFast) {
        Objects.requireNonNull(request, "request must not be null");
        Optional<Target> found = findTarget(request.contextName(), request.aggregateName());
        if (found.isEmpty()) {
            return BatchResult.failed(List.of(new BatchResult.BatchError(null, request.aggregateName(),
                aggregateNotFound(request.contextName(), request.aggregateName()))));
        }
        Target target = found.get();

        List<PendingElement> pending = pendingElements(request);
        List<BatchResult.BatchError> errors = new ArrayList<>();
        Set<String> batchNames = new HashSet<>();
        boolean batchHasRoot = false;

        for (PendingElement element : pending) {
            if (element.reusesExisting(target.aggregate())) {
                continue;
            }
            Optional<Rejection> rejection = check(target, element, batchNames, batchHasRoot);
            if (rejection.isPresent()) {
                errors.add(new BatchResult.BatchError(element.type(), element.name(), rejection.get().message()));
                if (failFast) {
                    break;
                }
                continue;
            }
            batchNames.add(element.name());
            batchHasRoot |= element.aggregateRoot();
        }

        if (!errors.isEmpty()) {
            log.debug("Rejected batch for {}.{}: {} error(s)", request.contextName(), request.aggregateName(),
                errors.size());
            return BatchResult.failed(errors);
        }

        Aggregate aggregate = target.aggregate();
        List<BatchResult.CreatedElement> created = new ArrayList<>();
        for (PendingElement element : pending) {
            Optional<ValueObject> existing = element.type() == ElementType.IDENTIFIER
                ? findValueObject(aggregate, element.name())
                : Optional.empty();
            if (existing.isPresent()) {
                created.add(new BatchResult.CreatedElement(element.type(), existing.get().id(), element.name()));
                continue;
            }
            String id = IdGenerator.newId();
            aggregate = element.addTo(aggregate, id);
            created.add(new BatchResult.CreatedElement(element.type(), id, element.name()));
        }
        model = model.replaceBoundedContext(target.context().replaceAggregate(aggregate));
        return BatchResult.succeeded(created);
    }

    private MutationResult addSingle(String contextName, String aggregateName, ElementType type, String rawName,
                                     boolean aggregateRoot, List<Attribute> attributes,
                                     List<ServiceOperation> operations) {
        Optional<Target> found = findTarget(contextName, aggregateName);
        if (found.isEmpty()) {
            return MutationResult.rejected(aggregateNotFound(contextName, aggregateName));
        }
        Target target = found.get();
        PendingElement element = new PendingElement(type, Identifiers.sanitize(rawName), aggregateRoot,
            attributes, operations);

        Optional<Rejection> rejection = check(target, element, Set.of(), false);
        if (rejection.isPresent()) {
            return MutationResult.rejected(rejection.get().error(), rejection.get().suggestion());
        }

        String id = IdGenerator.newId();
        Aggregate updated = element.addTo(target.aggregate(), id);
        model = model.replaceBoundedContext(target.context().replaceAggregate(updated));
        return MutationResult.created(id);
    }

    private Optional<Rejection> check(Target target, PendingElement element, Set<String> batchNames,
                                      boolean batchHasRoot) {
        String name = element.name();
        Aggregate aggregate = target.aggregate();
        String kind = element.type().displayName();

        if (element.type() != ElementType.IDENTIFIER) {
            ReservedNameCheck reserved = ReservedNames.isReservedDomainObjectName(name);
            if (reserved.reserved()) {
                return Optional.of(new Rejection(reservedMessage(name, kind), "Try: " + reserved.suggestionText()));
            }
        }
        if (batchNames.contains(name)) {
            return Optional.of(new Rejection("Duplicate name '" + name + "' within this batch", null));
        }
        if (element.existsIn(aggregate)) {
            return Optional.of(new Rejection(
                kind + " '" + name + "' already exists in aggregate '" + aggregate.name() + "'", null));
        }
        if (element.type() != ElementType.SERVICE) {
            Optional<String> location = findDomainObjectLocation(name);
            if (location.isPresent()) {
                return Optional.of(new Rejection(
                    kind + " name '" + name + "' already exists in " + location.get(),
                    "Use a unique prefixed name like '" + Identifiers.contextPrefix(target.context().name())
                        + name + "' instead"));
            }
        }
        if (element.aggregateRoot() && (batchHasRoot || aggregate.aggregateRoot().isPresent())) {
            String root = aggregate.aggregateRoot().map(Entity::name).orElse("another entity of this batch");
            return Optional.of(new Rejection(
                "Aggregate '" + aggregate.name() + "' already has an aggregate root: " + root, null));
        }
        for (Attribute attribute : element.attributes()) {
            Optional<Rejection> invalid = checkTyped(name, attribute.name(), attribute.type());
            if (invalid.isPresent()) {
                return invalid;
            }
        }
        for (ServiceOperation operation : element.operations()) {
            if (!Identifiers.isValid(operation.name())) {
                return Optional.of(new Rejection("Invalid operation name '" + operation.name() + "' in '" + name + "'",
                    Identifiers.sanitize(operation.name())));
            }
            String returnType = operation.returnType();
            if (!ServiceOperation.VOID.equals(returnType)) {
                TypeCheck check = AttributeTypeValidator.validateAttributeType(returnType);
                if (!check.valid()) {
                    return Optional.of(new Rejection("Invalid return type of '" + name + "." + operation.name()
                        + "': " + check.error(), check.suggestion()));
                }
            }
            for (Parameter parameter : operation.parameters()) {
                Optional<Rejection> invalid = checkTyped(name + "." + operation.name(), parameter.name(), parameter.type());
                if (invalid.isPresent()) {
                    return invalid;
                }
            }
        }
        return Optional.empty();
    }

    private static Optional<Rejection> checkTyped(String owner, String memberName, String type) {
        if (!Identifiers.isValid(memberName)) {
            return Optional.of(new Rejection("Invalid attribute name '" + memberName + "' in '" + owner + "'",
                Identifiers.sanitize(memberName)));
        }
        TypeCheck check = AttributeTypeValidator.validateAttributeType(type);
        if (!check.valid()) {
            return Optional.of(new Rejection(
                "Invalid type for '" + memberName + "' in '" + owner + "': " + check.error(), check.suggestion()));
        }
        return Optional.empty();
    }

    private Optional<String> findDomainObjectLocation(String name) {
        for (BoundedContext context : model.boundedContexts()) {
            for (Aggregate aggregate : context.allAggregates()) {
                for (DomainObject object : aggregate.domainObjects()) {
                    if (object.name().equals(name)) {
                        return Optional.of(context.name() + "." + aggregate.name());
                    }
                }
            }
        }
        return Optional.empty();
    }

    private Optional<Target> findTarget(String contextName, String aggregateName) {
        return model.findBoundedContext(contextName)
            .flatMap(context -> context.findAggregate(aggregateName)
                .map(aggregate -> new Target(context, aggregate)));
    }

    private static Optional<ValueObject> findValueObject(Aggregate aggregate, String name) {
        return aggregate.valueObjects().stream()
            .filter(vo -> vo.name().equals(name))
            .findFirst();
    }

    private static List<PendingElement> pendingElements(BatchRequest request) {
        List<PendingElement> pending = new ArrayList<>();
        for (String identifier : request.identifiers()) {
            pending.add(new PendingElement(ElementType.IDENTIFIER, identifierName(identifier), false,
                List.of(Attribute.of("value", "String")), List.of()));
        }
        for (ElementSpec spec : request.valueObjects()) {
            pending.add(new PendingElement(ElementType.VALUE_OBJECT, Identifiers.sanitize(spec.name()), false,
                spec.attributes(), List.of()));
        }
        for (EntitySpec spec : request.entities()) {
            pending.add(new PendingElement(ElementType.ENTITY, Identifiers.sanitize(spec.name()),
                spec.aggregateRoot(), spec.attributes(), List.of()));
        }
        for (ElementSpec spec : request.domainEvents()) {
            pending.add(new PendingElement(ElementType.DOMAIN_EVENT, Identifiers.sanitize(spec.name()), false,
                spec.attributes(), List.of()));
        }
        for (ElementSpec spec : request.commands()) {
            pending.add(new PendingElement(ElementType.COMMAND, Identifiers.sanitize(spec.name()), false,
                spec.attributes(), List.of()));
        }
        for (ServiceSpec spec : request.services()) {
            pending.add(new PendingElement(ElementType.SERVICE, Identifiers.sanitize(spec.name()), false,
                List.of(), spec.operations()));
        }
        return pending;
    }

    /**
     * Normalizes an identifier name: {@code customer} and {@code customerId} both become
     * {@code CustomerId}.
     */
    static String identifierName(String rawName) {
        String name = Identifiers.sanitize(rawName);
        if (!name.endsWith(IDENTIFIER_SUFFIX)) {
            name = name + IDENTIFIER_SUFFIX;
        }
        return name.substring(0, 1).toUpperCase(Locale.ROOT) + name.substring(1);
    }

    /**
     * Brings a type into the form the parser produces, so that a workspace-built model
     * round-trips through text unchanged.
     */
    static String canonicalType(String type) {
        String trimmed = type.trim();
        Matcher collection = COLLECTION_TYPE.matcher(trimmed);
        if (collection.matches()) {
            return collection.group(1) + "<" + collection.group(2) + ">";
        }
        Matcher reference = REFERENCE_TYPE.matcher(trimmed);
        if (reference.matches()) {
            return "- " + reference.group(1);
        }
        return trimmed;
    }

    private static String reservedMessage(String name, String kind) {
        String article = "AEIOU".indexOf(kind.charAt(0)) >= 0 ? "an" : "a";
        return "'" + name + "' is a reserved CML keyword and cannot be used as " + article + " " + kind + " name";
    }

    private static String aggregateNotFound(String contextName, String aggregateName) {
        return "Aggregate '" + aggregateName + "' not found in context '" + contextName + "'";
    }

    private record Target(BoundedContext context, Aggregate aggregate) {}

    private record Rejection(String error, String suggestion) {
        String message() {
            return suggestion == null ? error : error + ". " + suggestion;
        }
    }

    /**
     * An element that passed sanitization and waits to be checked and added.
     */
    private record PendingElement(
        ElementType type,
        String name,
        boolean aggregateRoot,
        List<Attribute> attributes,
        List<ServiceOperation> operations
    ) {
        boolean reusesExisting(Aggregate aggregate) {
            return type == ElementType.IDENTIFIER && findValueObject(aggregate, name).isPresent();
        }

        boolean existsIn(Aggregate aggregate) {
            switch (type) {
                case IDENTIFIER:
                case VALUE_OBJECT:
                    return aggregate.valueObjects().stream().anyMatch(vo -> vo.name().equals(name));
                case ENTITY:
                    return aggregate.entities().stream().anyMatch(e -> e.name().equals(name));
                case DOMAIN_EVENT:
                    return aggregate.domainEvents().stream().anyMatch(e -> e.name().equals(name));
                case COMMAND:
                    return aggregate.commands().stream().anyMatch(c -> c.name().equals(name));
                case SERVICE:
                    return aggregate.services().stream().anyMatch(s -> s.name().equals(name));
                default:
                    throw new IllegalStateException("Unknown element type: " + type);
            }
        }

        Aggregate addTo(Aggregate aggregate, String id) {
            List<Attribute> canonical = attributes.stream()
                .map(a -> new Attribute(a.name(), canonicalType(a.type()), a.key(), a.nullable()))
                .toList();
            switch (type) {
                case IDENTIFIER:
                case VALUE_OBJECT:
                    return aggregate.withValueObject(new ValueObject(id, name, canonical));
                case ENTITY:
                    return aggregate.withEntity(new Entity(id, name, aggregateRoot, canonical, List.of()));
                case DOMAIN_EVENT:
                    return aggregate.withDomainEvent(new DomainEvent(id, name, canonical));
                case COMMAND:
                    return aggregate.withCommand(new Command(id, name, canonical));
                case SERVICE:
                    return aggregate.withService(new DomainService(id, name, canonicalOperations()));
                default:
                    throw new IllegalStateException("Unknown element type: " + type);
            }
        }

        private List<ServiceOperation> canonicalOperations() {
            return operations.stream()
                .map(op -> new ServiceOperation(op.name(), canonicalType(op.returnType()),
                    op.parameters().stream()
                        .map(p -> new Parameter(p.name(), canonicalType(p.type())))
                        .toList()))
                .toList();
        }
    }
}
