package com.solparser.jackson;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.Version;
import com.fasterxml.jackson.databind.*;
import com.fasterxml.jackson.databind.deser.BeanDeserializerModifier;
import com.fasterxml.jackson.databind.deser.ResolvableDeserializer;
import com.fasterxml.jackson.databind.jsontype.NamedType;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.ser.BeanPropertyWriter;
import com.fasterxml.jackson.databind.ser.BeanSerializerModifier;
import com.fasterxml.jackson.databind.util.NameTransformer;
import com.solparser.ast.Node;
import com.solparser.ast.SourceLocation;
import com.solparser.jackson.mixins.NodeMixin;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Jackson module for the AST records.
 *
 * This module handles:
 * - Polymorphic node types via NodeMixin on every node interface
 * - Writing the {@code location} component as {@code src}
 * - Reading {@code src} back into {@code location}
 */
public class AstModule extends SimpleModule {

    private static final String LOCATION_PROPERTY = "location";
    private static final String SRC_PROPERTY = "src";

    private static final NameTransformer LOCATION_TO_SRC = new NameTransformer() {
        @Override
        public String transform(String name) {
            return SRC_PROPERTY;
        }

        @Override
        public String reverse(String transformed) {
            return LOCATION_PROPERTY;
        }
    };

    public AstModule() {
        super("AstModule", new Version(1, 0, 0, null, "com.solparser", "solparser-jackson"));
        addSerializer(SourceLocation.class, new SourceLocationSerializer());
        addDeserializer(SourceLocation.class, new SourceLocationDeserializer());
    }

    @Override
    public void setupModule(SetupContext context) {
        super.setupModule(context);

        // Mixin goes on each interface explicitly, records register under their simple name
        List<NamedType> nodeTypes = new ArrayList<>();
        registerNodeHierarchy(context, Node.class, nodeTypes);
        context.registerSubtypes(nodeTypes.toArray(new NamedType[0]));

        context.addBeanSerializerModifier(new AstSerializerModifier());
        context.addBeanDeserializerModifier(new AstDeserializerModifier());
    }

    private static void registerNodeHierarchy(SetupContext context, Class<?> type, List<NamedType> nodeTypes) {
        if (type.isInterface()) {
            context.setMixInAnnotations(type, NodeMixin.class);
            for (Class<?> permitted : type.getPermittedSubclasses()) {
                registerNodeHierarchy(context, permitted, nodeTypes);
            }
        } else if (nodeTypes.stream().noneMatch(named -> named.getType() == type)) {
            nodeTypes.add(new NamedType(type, type.getSimpleName()));
        }
    }

    // ==================== Serializer Modifier ====================

    private static class AstSerializerModifier extends BeanSerializerModifier {
        @Override
        public List<BeanPropertyWriter> changeProperties(SerializationConfig config,
                                                          BeanDescription beanDesc,
                                                          List<BeanPropertyWriter> beanProperties) {
            if (!Node.class.isAssignableFrom(beanDesc.getBeanClass())) {
                return beanProperties;
            }
            List<BeanPropertyWriter> renamed = new ArrayList<>(beanProperties.size());
            for (BeanPropertyWriter prop : beanProperties) {
                if (LOCATION_PROPERTY.equals(prop.getName())) {
                    renamed.add(prop.rename(LOCATION_TO_SRC));
                } else {
                    renamed.add(prop);
                }
            }
            return renamed;
        }
    }

    // ==================== Deserializer Modifier ====================

    private static class AstDeserializerModifier extends BeanDeserializerModifier {
        @Override
        public JsonDeserializer<?> modifyDeserializer(DeserializationConfig config,
                                                       BeanDescription beanDesc,
                                                       JsonDeserializer<?> deserializer) {
            Class<?> beanClass = beanDesc.getBeanClass();
            if (Node.class.isAssignableFrom(beanClass) && beanClass.isRecord()) {
                return new AstNodeDeserializer(deserializer);
            }
            return deserializer;
        }
    }

    /**
     * Renames {@code src} back to {@code location} on one node object before handing it
     * to the record deserializer. Child nodes pass through their own instance.
     */
    private static class AstNodeDeserializer extends JsonDeserializer<Object> implements ResolvableDeserializer {
        private final JsonDeserializer<?> delegate;

        AstNodeDeserializer(JsonDeserializer<?> delegate) {
            this.delegate = delegate;
        }

        @Override
        public void resolve(DeserializationContext ctxt) throws JsonMappingException {
            if (delegate instanceof ResolvableDeserializer) {
                ((ResolvableDeserializer) delegate).resolve(ctxt);
            }
        }

        @Override
        public Object deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            JsonNode node = p.readValueAsTree();
            if (node instanceof ObjectNode objNode && objNode.has(SRC_PROPERTY)) {
                objNode.set(LOCATION_PROPERTY, objNode.remove(SRC_PROPERTY));
            }
            JsonParser jp = node.traverse(p.getCodec());
            jp.nextToken();
            return delegate.deserialize(jp, ctxt);
        }
    }
}
