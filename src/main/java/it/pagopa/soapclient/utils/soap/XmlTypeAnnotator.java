package it.pagopa.soapclient.utils.soap;

import it.pagopa.soapclient.model.XmlTyper;

import javax.xml.bind.JAXBElement;
import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Walks a request object graph and invokes {@link XmlTyper#setXmlType()} on every reachable
 * implementor, before descending into its fields.
 * <p>
 * Traversal rules:
 * <ul>
 * <li>{@code null} values are skipped</li>
 * <li>{@link JAXBElement}s are unwrapped to the value they hold</li>
 * <li>arrays and {@link Collection}s are visited element by element, in iteration order</li>
 * <li>maps, enums and JDK types ({@code java.*}, {@code javax.*}, {@code jdk.*},
 * {@code sun.*}) are leaves</li>
 * <li>any other object is visited field by field, superclass fields included</li>
 * </ul>
 * Only the objects on the current path are remembered, so a cyclic graph terminates while an
 * object shared by two branches is annotated once per branch. No state survives a call.
 */
public final class XmlTypeAnnotator {

    private static final List<String> JDK_PACKAGE_PREFIXES = List.of("java.", "javax.", "jdk.", "sun.");

    private static final ConcurrentMap<Class<?>, List<Field>> fieldsCache = new ConcurrentHashMap<>();

    private XmlTypeAnnotator() {
    }

    /**
     * Annotate the given object graph in place.
     *
     * @param value the graph root, may be null
     */
    public static void annotate(Object value) {
        annotate(value, Collections.newSetFromMap(new IdentityHashMap<>()));
    }

    private static void annotate(
                                 Object value,
                                 Set<Object> path
    ) {
        if (value == null) {
            return;
        }
        if (value instanceof JAXBElement<?> element) {
            annotate(element.getValue(), path);
            return;
        }
        Class<?> clazz = value.getClass();
        if (clazz.isArray() && clazz.getComponentType().isPrimitive()) {
            return;
        }
        boolean container = clazz.isArray() || value instanceof Collection<?>;
        if (!container && isLeaf(value)) {
            return;
        }
        if (!path.add(value)) {
            return;
        }
        try {
            if (clazz.isArray()) {
                for (Object item : (Object[]) value) {
                    annotate(item, path);
                }
            } else if (value instanceof Collection<?> collection) {
                for (Object item : collection) {
                    annotate(item, path);
                }
            } else {
                if (value instanceof XmlTyper xmlTyper) {
                    xmlTyper.setXmlType();
                }
                for (Field field : fieldsOf(clazz)) {
                    annotate(readField(field, value), path);
                }
            }
        } finally {
            path.remove(value);
        }
    }

    private static boolean isLeaf(Object value) {
        if (value instanceof Enum<?> || value instanceof Map<?, ?>) {
            return true;
        }
        return isJdkType(value.getClass());
    }

    private static boolean isJdkType(Class<?> clazz) {
        String packageName = clazz.getPackageName();
        return JDK_PACKAGE_PREFIXES.stream().anyMatch(packageName::startsWith);
    }

    private static List<Field> fieldsOf(Class<?> clazz) {
        return fieldsCache.computeIfAbsent(clazz, XmlTypeAnnotator::collectFields);
    }

    private static List<Field> collectFields(Class<?> clazz) {
        List<Field> fields = new ArrayList<>();
        for (Class<?> current = clazz; current != null && !isJdkType(current); current = current.getSuperclass()) {
            for (Field field : current.getDeclaredFields()) {
                if (Modifier.isStatic(field.getModifiers()) || field.isSynthetic() || field.getType().isPrimitive()) {
                    continue;
                }
                if (field.trySetAccessible()) {
                    fields.add(field);
                }
            }
        }
        return List.copyOf(fields);
    }

    private static Object readField(
                                    Field field,
                                    Object target
    ) {
        try {
            return field.get(target);
        } catch (IllegalAccessException e) {
            throw new IllegalStateException("Cannot read field " + field, e);
        }
    }
}
