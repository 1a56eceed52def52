package com.cmlarchitect.core.writer;

import com.cmlarchitect.core.model.Aggregate;
import com.cmlarchitect.core.model.Attribute;
import com.cmlarchitect.core.model.BoundedContext;
import com.cmlarchitect.core.model.CmlModel;
import com.cmlarchitect.core.model.Command;
import com.cmlarchitect.core.model.ContextMap;
import com.cmlarchitect.core.model.DomainEvent;
import com.cmlarchitect.core.model.DomainModule;
import com.cmlarchitect.core.model.DomainService;
import com.cmlarchitect.core.model.Entity;
import com.cmlarchitect.core.model.Relationship;
import com.cmlarchitect.core.model.ServiceOperation;
import com.cmlarchitect.core.model.SymmetricRelationship;
import com.cmlarchitect.core.model.UpstreamDownstreamRelationship;
import com.cmlarchitect.core.model.ValueObject;
import com.cmlarchitect.core.validation.CmlKeywords;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Serializes a {@link CmlModel} back to CML text.
 *
 * <p>Output is deterministic and parses back to a model equal to the input in every field
 * except generated ids. Writing the re-parsed model again yields identical text.
 *
 * <p>Escaping with {@code ^}:
 * <ul>
 *   <li>attribute and parameter names that match a CML keyword in any case</li>
 *   <li>any other name that is exactly a keyword of the grammar</li>
 * </ul>
 *
 * <p>Instances are not thread-safe; create one per serialization or use {@link #toCml(CmlModel)}.
 */
public class CmlWriter {

    private static final Pattern COLLECTION_TYPE = Pattern.compile("^(List|Set)\\s*<\\s*(\\S+?)\\s*>$");
    private static final Pattern REFERENCE_TYPE = Pattern.compile("^-\\s*(\\S+)$");

    private final WriterConfig config;
    private final List<String> lines = new ArrayList<>();
    private int depth;

    public CmlWriter() {
        this(WriterConfig.defaults());
    }

    public CmlWriter(WriterConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    /**
     * Serializes a model with the default configuration.
     *
     * @param model model to write
     * @return CML text
     */
    public static String toCml(CmlModel model) {
        return new CmlWriter().serialize(model);
    }

    /**
     * Serializes a model: the context map first, then every bounded context, each followed
     * by a blank line.
     *
     * @param model model to write
     * @return CML text
     */
    public String serialize(CmlModel model) {
        Objects.requireNonNull(model, "model must not be null");
        lines.clear();
        depth = 0;

        model.findContextMap().ifPresent(contextMap -> {
            writeContextMap(contextMap);
            blank();
        });
        for (BoundedContext context : model.boundedContexts()) {
            writeBoundedContext(context);
            blank();
        }
        return String.join("\n", lines);
    }

    private void writeContextMap(ContextMap contextMap) {
        open("ContextMap " + name(contextMap.name()));
        if (contextMap.type() != null) {
            line("type = " + name(contextMap.type()));
        }
        line("state = " + contextMap.state().name());
        if (!contextMap.boundedContexts().isEmpty()) {
            line("contains " + names(contextMap.boundedContexts()));
        }
        blank();
        for (Relationship relationship : contextMap.relationships()) {
            relationship.match(this::writeSymmetric, this::writeUpstreamDownstream);
        }
        close();
    }

    private Void writeSymmetric(SymmetricRelationship relationship) {
        line(name(relationship.participant1()) + " [" + relationship.type().keyword() + "] "
            + name(relationship.participant2()));
        return null;
    }

    private Void writeUpstreamDownstream(UpstreamDownstreamRelationship relationship) {
        String upstreamRoles = Stream.concat(
            Stream.of("U"),
            relationship.upstreamPatterns().stream().map(Enum::name)
        ).collect(Collectors.joining(","));
        String downstreamRoles = Stream.concat(
            Stream.of("D"),
            relationship.downstreamPatterns().stream().map(Enum::name)
        ).collect(Collectors.joining(","));
        String header = name(relationship.upstream()) + " [" + upstreamRoles + "] -> ["
            + downstreamRoles + "] " + name(relationship.downstream());

        boolean hasBody = !relationship.exposedAggregates().isEmpty() || relationship.downstreamRights() != null;
        if (!hasBody) {
            line(header);
            return null;
        }
        open(header);
        if (!relationship.exposedAggregates().isEmpty()) {
            line("exposedAggregates = " + names(relationship.exposedAggregates()));
        }
        if (relationship.downstreamRights() != null) {
            line("downstreamRights = " + relationship.downstreamRights().name());
        }
        close();
        return null;
    }

    private void writeBoundedContext(BoundedContext context) {
        String header = "BoundedContext " + name(context.name());
        if (!context.implementedSubdomains().isEmpty()) {
            header += " implements " + names(context.implementedSubdomains());
        }
        open(header);
        if (context.domainVisionStatement() != null) {
            line("domainVisionStatement = " + quote(context.domainVisionStatement()));
        }
        if (!context.responsibilities().isEmpty()) {
            line("responsibilities = " + quoteAll(context.responsibilities()));
        }
        if (context.implementationTechnology() != null) {
            line("implementationTechnology = " + quote(context.implementationTechnology()));
        }
        if (context.knowledgeLevel() != null) {
            line("knowledgeLevel = " + context.knowledgeLevel().name());
        }
        for (Aggregate aggregate : context.aggregates()) {
            blank();
            writeAggregate(aggregate);
        }
        for (DomainModule module : context.modules()) {
            blank();
            writeModule(module);
        }
        close();
    }

    private void writeModule(DomainModule module) {
        open("Module " + name(module.name()));
        boolean first = true;
        for (Aggregate aggregate : module.aggregates()) {
            if (!first) {
                blank();
            }
            writeAggregate(aggregate);
            first = false;
        }
        close();
    }

    private void writeAggregate(Aggregate aggregate) {
        open("Aggregate " + name(aggregate.name()));
        if (!aggregate.responsibilities().isEmpty()) {
            line("responsibilities = " + quoteAll(aggregate.responsibilities()));
        }
        if (aggregate.knowledgeLevel() != null) {
            line("knowledgeLevel = " + aggregate.knowledgeLevel().name());
        }
        for (Entity entity : aggregate.entities()) {
            blank();
            writeEntity(entity);
        }
        for (ValueObject valueObject : aggregate.valueObjects()) {
            blank();
            writeAttributed("ValueObject", valueObject.name(), valueObject.attributes());
        }
        for (DomainEvent domainEvent : aggregate.domainEvents()) {
            blank();
            writeAttributed("DomainEvent", domainEvent.name(), domainEvent.attributes());
        }
        for (Command command : aggregate.commands()) {
            blank();
            writeAttributed("Command", command.name(), command.attributes());
        }
        for (DomainService service : aggregate.services()) {
            blank();
            writeService(service);
        }
        close();
    }

    private void writeEntity(Entity entity) {
        String header = "Entity " + name(entity.name());
        if (entity.attributes().isEmpty() && entity.operations().isEmpty() && !entity.aggregateRoot()) {
            line(header);
            return;
        }
        open(header);
        if (entity.aggregateRoot()) {
            line("aggregateRoot");
        }
        entity.attributes().forEach(this::writeAttribute);
        entity.operations().forEach(this::writeOperation);
        close();
    }

    private void writeAttributed(String keyword, String elementName, List<Attribute> attributes) {
        String header = keyword + " " + name(elementName);
        if (attributes.isEmpty()) {
            line(header);
            return;
        }
        open(header);
        attributes.forEach(this::writeAttribute);
        close();
    }

    private void writeService(DomainService service) {
        String header = "Service " + name(service.name());
        if (service.operations().isEmpty()) {
            line(header);
            return;
        }
        open(header);
        service.operations().forEach(this::writeOperation);
        close();
    }

    private void writeAttribute(Attribute attribute) {
        StringBuilder text = new StringBuilder()
            .append(type(attribute.type()))
            .append(' ')
            .append(attributeName(attribute.name()));
        if (attribute.key()) {
            text.append(" key");
        }
        if (attribute.nullable()) {
            text.append(" nullable");
        }
        line(text.toString());
    }

    private void writeOperation(ServiceOperation operation) {
        String parameters = operation.parameters().stream()
            .map(parameter -> type(parameter.type()) + " " + attributeName(parameter.name()))
            .collect(Collectors.joining(", "));
        line("def " + type(operation.returnType()) + " " + name(operation.name()) + "(" + parameters + ")");
    }

    // Type text is canonical ("List<X>", "- X", "X"); only the identifiers may need escaping.
    private static String type(String type) {
        Matcher collection = COLLECTION_TYPE.matcher(type);
        if (collection.matches()) {
            return collection.group(1) + "<" + name(collection.group(2)) + ">";
        }
        Matcher reference = REFERENCE_TYPE.matcher(type);
        if (reference.matches()) {
            return "- " + name(reference.group(1));
        }
        return name(type);
    }

    private static String name(String name) {
        return CmlKeywords.isGrammarKeyword(name) ? "^" + name : name;
    }

    private static String attributeName(String name) {
        return CmlKeywords.isReservedAttributeName(name) ? "^" + name : name;
    }

    private static String names(List<String> names) {
        return names.stream().map(CmlWriter::name).collect(Collectors.joining(", "));
    }

    private static String quote(String value) {
        return "\"" + value.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
    }

    private static String quoteAll(List<String> values) {
        return values.stream().map(CmlWriter::quote).collect(Collectors.joining(", "));
    }

    private void open(String header) {
        line(header + " {");
        depth++;
    }

    private void close() {
        depth--;
        line("}");
    }

    private void line(String text) {
        lines.add(config.indent().repeat(depth) + text);
    }

    private void blank() {
        lines.add("");
    }
}
