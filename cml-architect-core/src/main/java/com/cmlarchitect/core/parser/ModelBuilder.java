package com.cmlarchitect.core.parser;

import com.cmlarchitect.core.model.Aggregate;
import com.cmlarchitect.core.model.Attribute;
import com.cmlarchitect.core.model.BoundedContext;
import com.cmlarchitect.core.model.CmlModel;
import com.cmlarchitect.core.model.Command;
import com.cmlarchitect.core.model.ContextMap;
import com.cmlarchitect.core.model.ContextMapState;
import com.cmlarchitect.core.model.DomainEvent;
import com.cmlarchitect.core.model.DomainModule;
import com.cmlarchitect.core.model.DomainService;
import com.cmlarchitect.core.model.DownstreamPattern;
import com.cmlarchitect.core.model.DownstreamRights;
import com.cmlarchitect.core.model.Entity;
import com.cmlarchitect.core.model.KnowledgeLevel;
import com.cmlarchitect.core.model.Parameter;
import com.cmlarchitect.core.model.Relationship;
import com.cmlarchitect.core.model.ServiceOperation;
import com.cmlarchitect.core.model.SymmetricRelationship;
import com.cmlarchitect.core.model.SymmetricRelationshipType;
import com.cmlarchitect.core.model.UpstreamDownstreamRelationship;
import com.cmlarchitect.core.model.UpstreamPattern;
import com.cmlarchitect.core.model.ValueObject;
import com.cmlarchitect.core.util.IdGenerator;
import com.cmlarchitect.parser.CmlParser;
import org.antlr.v4.runtime.tree.TerminalNode;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Builds the typed {@link CmlModel} from a parse tree that has no syntax errors.
 *
 * <p>Every grammar rule is read through the context classes ANTLR generates for it, so a
 * change to the grammar surfaces here as a compile error rather than a silent lookup miss.
 *
 * <p>The builder:
 * <ul>
 *   <li>assigns a fresh id to every element</li>
 *   <li>removes {@code ^} escapes from names and quotes from strings</li>
 *   <li>defaults the context map state to {@code AS_IS} and operation return types to {@code void}</li>
 *   <li>keeps the first context map of a document and ignores later ones</li>
 *   <li>keeps every {@code aggregateRoot} flag; the aggregate reports the first flagged entity as
 *       its root and the validator reports any extra roots</li>
 * </ul>
 */
class ModelBuilder {

    private static final char ESCAPE_PREFIX = '^';

    /**
     * Builds the model for a whole document.
     *
     * @param ctx root of the parse tree
     * @return model
     */
    CmlModel build(CmlParser.CmlModelContext ctx) {
        ContextMap contextMap = ctx.contextMapDecl().isEmpty()
            ? null
            : buildContextMap(ctx.contextMapDecl(0));

        List<BoundedContext> boundedContexts = ctx.boundedContextDecl().stream()
            .map(this::buildBoundedContext)
            .toList();

        return new CmlModel(CmlModel.DEFAULT_NAME, contextMap, boundedContexts);
    }

    private ContextMap buildContextMap(CmlParser.ContextMapDeclContext ctx) {
        String name = ctx.name() != null ? name(ctx.name()) : ContextMap.DEFAULT_NAME;
        String type = null;
        ContextMapState state = null;
        List<String> contains = new ArrayList<>();
        List<Relationship> relationships = new ArrayList<>();

        for (CmlParser.ContextMapElementContext element : ctx.contextMapElement()) {
            if (element.contextMapType() != null) {
                type = name(element.contextMapType().name());
            } else if (element.contextMapState() != null) {
                state = element.contextMapState().TO_BE() != null ? ContextMapState.TO_BE : ContextMapState.AS_IS;
            } else if (element.contextMapContains() != null) {
                element.contextMapContains().name().forEach(n -> contains.add(name(n)));
            } else if (element.relationshipDecl() != null) {
                relationships.add(buildRelationship(element.relationshipDecl()));
            }
        }

        return new ContextMap(IdGenerator.newId(), name, type, state, contains, relationships);
    }

    private Relationship buildRelationship(CmlParser.RelationshipDeclContext ctx) {
        if (ctx.symmetricRelationship() != null) {
            CmlParser.SymmetricRelationshipContext sym = ctx.symmetricRelationship();
            SymmetricRelationshipType type = sym.symmetricType().SHARED_KERNEL() != null
                ? SymmetricRelationshipType.SHARED_KERNEL
                : SymmetricRelationshipType.PARTNERSHIP;
            return new SymmetricRelationship(IdGenerator.newId(), type,
                name(sym.participant1), name(sym.participant2));
        }
        return buildUpstreamDownstream(ctx.upstreamDownstreamRelationship());
    }

    private UpstreamDownstreamRelationship buildUpstreamDownstream(
            CmlParser.UpstreamDownstreamRelationshipContext ctx) {
        Set<UpstreamPattern> upstreamPatterns = EnumSet.noneOf(UpstreamPattern.class);
        if (ctx.upstreamRoles() != null) {
            for (CmlParser.UpstreamPatternContext pattern : ctx.upstreamRoles().upstreamPattern()) {
                upstreamPatterns.add(pattern.OHS() != null ? UpstreamPattern.OHS : UpstreamPattern.PL);
            }
        }

        Set<DownstreamPattern> downstreamPatterns = EnumSet.noneOf(DownstreamPattern.class);
        if (ctx.downstreamRoles() != null) {
            for (CmlParser.DownstreamPatternContext pattern : ctx.downstreamRoles().downstreamPattern()) {
                downstreamPatterns.add(pattern.ACL() != null ? DownstreamPattern.ACL : DownstreamPattern.CF);
            }
        }

        List<String> exposedAggregates = new ArrayList<>();
        DownstreamRights downstreamRights = null;
        if (ctx.relationshipBody() != null) {
            for (CmlParser.RelationshipPropertyContext property : ctx.relationshipBody().relationshipProperty()) {
                if (property instanceof CmlParser.ExposedAggregatesPropertyContext exposed) {
                    exposed.name().forEach(n -> exposedAggregates.add(name(n)));
                } else if (property instanceof CmlParser.DownstreamRightsPropertyContext rights) {
                    downstreamRights = downstreamRights(rights);
                }
            }
        }

        return new UpstreamDownstreamRelationship(IdGenerator.newId(),
            name(ctx.upstream), name(ctx.downstream),
            upstreamPatterns, downstreamPatterns, exposedAggregates, downstreamRights);
    }

    private DownstreamRights downstreamRights(CmlParser.DownstreamRightsPropertyContext ctx) {
        if (ctx.INFLUENCER() != null) {
            return DownstreamRights.INFLUENCER;
        }
        if (ctx.OPINIONATED_CONFORMIST() != null) {
            return DownstreamRights.OPINIONATED_CONFORMIST;
        }
        return DownstreamRights.VETO_RIGHT;
    }

    private BoundedContext buildBoundedContext(CmlParser.BoundedContextDeclContext ctx) {
        List<CmlParser.NameContext> names = ctx.name();
        String contextName = name(names.get(0));
        List<String> implementedSubdomains = names.subList(1, names.size()).stream()
            .map(this::name)
            .toList();

        String domainVisionStatement = null;
        List<String> responsibilities = new ArrayList<>();
        String implementationTechnology = null;
        KnowledgeLevel knowledgeLevel = null;
        List<Aggregate> aggregates = new ArrayList<>();
        List<DomainModule> modules = new ArrayList<>();

        for (CmlParser.BoundedContextElementContext element : ctx.boundedContextElement()) {
            if (element.domainVisionStatementDecl() != null) {
                domainVisionStatement = string(element.domainVisionStatementDecl().STRING());
            } else if (element.responsibilitiesDecl() != null) {
                responsibilities.addAll(strings(element.responsibilitiesDecl()));
            } else if (element.implementationTechnologyDecl() != null) {
                implementationTechnology = string(element.implementationTechnologyDecl().STRING());
            } else if (element.knowledgeLevelDecl() != null) {
                knowledgeLevel = knowledgeLevel(element.knowledgeLevelDecl());
            } else if (element.aggregateDecl() != null) {
                aggregates.add(buildAggregate(element.aggregateDecl()));
            } else if (element.moduleDecl() != null) {
                modules.add(buildModule(element.moduleDecl()));
            }
        }

        return new BoundedContext(IdGenerator.newId(), contextName, implementedSubdomains,
            domainVisionStatement, responsibilities, implementationTechnology, knowledgeLevel,
            aggregates, modules);
    }

    private DomainModule buildModule(CmlParser.ModuleDeclContext ctx) {
        List<Aggregate> aggregates = ctx.aggregateDecl().stream()
            .map(this::buildAggregate)
            .toList();
        return new DomainModule(IdGenerator.newId(), name(ctx.name()), aggregates);
    }

    private Aggregate buildAggregate(CmlParser.AggregateDeclContext ctx) {
        List<String> responsibilities = new ArrayList<>();
        KnowledgeLevel knowledgeLevel = null;
        List<Entity> entities = new ArrayList<>();
        List<ValueObject> valueObjects = new ArrayList<>();
        List<DomainEvent> domainEvents = new ArrayList<>();
        List<Command> commands = new ArrayList<>();
        List<DomainService> services = new ArrayList<>();

        for (CmlParser.AggregateElementContext element : ctx.aggregateElement()) {
            if (element.responsibilitiesDecl() != null) {
                responsibilities.addAll(strings(element.responsibilitiesDecl()));
            } else if (element.knowledgeLevelDecl() != null) {
                knowledgeLevel = knowledgeLevel(element.knowledgeLevelDecl());
            } else if (element.entityDecl() != null) {
                entities.add(buildEntity(element.entityDecl()));
            } else if (element.valueObjectDecl() != null) {
                CmlParser.ValueObjectDeclContext vo = element.valueObjectDecl();
                valueObjects.add(new ValueObject(IdGenerator.newId(), name(vo.name()), attributes(vo.attributeDecl())));
            } else if (element.domainEventDecl() != null) {
                CmlParser.DomainEventDeclContext event = element.domainEventDecl();
                domainEvents.add(new DomainEvent(IdGenerator.newId(), name(event.name()), attributes(event.attributeDecl())));
            } else if (element.commandDecl() != null) {
                CmlParser.CommandDeclContext command = element.commandDecl();
                commands.add(new Command(IdGenerator.newId(), name(command.name()), attributes(command.attributeDecl())));
            } else if (element.serviceDecl() != null) {
                CmlParser.ServiceDeclContext service = element.serviceDecl();
                services.add(new DomainService(IdGenerator.newId(), name(service.name()), operations(service.operationDecl())));
            }
        }

        return new Aggregate(IdGenerator.newId(), name(ctx.name()), responsibilities, knowledgeLevel,
            entities, valueObjects, domainEvents, commands, services);
    }

    private Entity buildEntity(CmlParser.EntityDeclContext ctx) {
        boolean aggregateRoot = false;
        List<Attribute> attributes = new ArrayList<>();
        List<ServiceOperation> operations = new ArrayList<>();

        for (CmlParser.EntityElementContext element : ctx.entityElement()) {
            if (element.AGGREGATE_ROOT() != null) {
                aggregateRoot = true;
            } else if (element.attributeDecl() != null) {
                attributes.add(attribute(element.attributeDecl()));
            } else if (element.operationDecl() != null) {
                operations.add(operation(element.operationDecl()));
            }
        }

        return new Entity(IdGenerator.newId(), name(ctx.name()), aggregateRoot, attributes, operations);
    }

    private List<Attribute> attributes(List<CmlParser.AttributeDeclContext> contexts) {
        return contexts.stream().map(this::attribute).toList();
    }

    private Attribute attribute(CmlParser.AttributeDeclContext ctx) {
        return new Attribute(
            unescape(ctx.attributeName().getText()),
            typeText(ctx.typeRef()),
            ctx.KEY() != null,
            ctx.NULLABLE() != null
        );
    }

    private List<ServiceOperation> operations(List<CmlParser.OperationDeclContext> contexts) {
        return contexts.stream().map(this::operation).toList();
    }

    private ServiceOperation operation(CmlParser.OperationDeclContext ctx) {
        String returnType = ctx.returnType != null ? typeText(ctx.returnType) : null;
        List<Parameter> parameters = ctx.parameterDecl().stream()
            .map(p -> new Parameter(unescape(p.attributeName().getText()), typeText(p.typeRef())))
            .toList();
        return new ServiceOperation(name(ctx.name()), returnType, parameters);
    }

    /**
     * Renders a type reference in the canonical form stored in the model:
     * {@code String}, {@code List<OrderLine>} or {@code - CustomerId}.
     */
    private String typeText(CmlParser.TypeRefContext ctx) {
        if (ctx.collectionType() != null) {
            CmlParser.CollectionTypeContext collection = ctx.collectionType();
            String kind = collection.LIST() != null ? "List" : "Set";
            return kind + "<" + name(collection.name()) + ">";
        }
        if (ctx.MINUS() != null) {
            return "- " + name(ctx.name());
        }
        return name(ctx.name());
    }

    private KnowledgeLevel knowledgeLevel(CmlParser.KnowledgeLevelDeclContext ctx) {
        return ctx.META() != null ? KnowledgeLevel.META : KnowledgeLevel.CONCRETE;
    }

    private List<String> strings(CmlParser.ResponsibilitiesDeclContext ctx) {
        return ctx.STRING().stream().map(this::string).toList();
    }

    private String name(CmlParser.NameContext ctx) {
        return unescape(ctx.getText());
    }

    private static String unescape(String identifier) {
        return identifier.charAt(0) == ESCAPE_PREFIX ? identifier.substring(1) : identifier;
    }

    /**
     * Strips the surrounding quotes of a string literal and resolves backslash escapes.
     */
    private String string(TerminalNode node) {
        String literal = node.getText();
        String body = literal.substring(1, literal.length() - 1);
        StringBuilder sb = new StringBuilder(body.length());
        for (int i = 0; i < body.length(); i++) {
            char c = body.charAt(i);
            if (c == '\\' && i + 1 < body.length()) {
                i++;
                c = body.charAt(i);
            }
            sb.append(c);
        }
        return sb.toString();
    }
}
