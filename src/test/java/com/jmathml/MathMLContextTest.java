package com.jmathml;

import com.jmathml.symbols.ExtendedMathExtension;
import com.jmathml.symbols.NamespaceContext;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class MathMLContextTest {

    @Test
    public void testUnversionedDefaults() {
        MathMLContext context = MathMLContext.unversioned();

        assertNull(context.namespaces());
        assertEquals(3, context.level());
        assertEquals(2, context.version());
        assertEquals(MathMLContext.DEFAULT_MAX_DEPTH, context.maxDepth());
        assertEquals(1, context.symbols().extensions().size());
    }

    @Test
    public void testVersioned() {
        MathMLContext context = MathMLContext.of(2, 4);

        assertEquals(new NamespaceContext(2, 4), context.namespaces());
        assertEquals(2, context.level());
        assertEquals(4, context.version());
    }

    @Test
    public void testWithoutExtensions() {
        MathMLContext context = MathMLContext.builder().withoutExtensions().build();

        assertTrue(context.symbols().extensions().isEmpty());
        assertNull(context.definitionUrls().lookup(ExtendedMathExtension.RATE_OF_URL));
        assertNull(MathML.parse("<math xmlns=\"http://www.w3.org/1998/Math/MathML\">"
            + "<apply><max/><cn>1</cn><cn>2</cn></apply></math>", context));
    }

    @Test
    public void testDefinitionUrlsArePopulatedForTheContext() {
        assertNotNull(MathMLContext.of(NamespaceContext.L3V2).definitionUrls()
            .lookup(ExtendedMathExtension.RATE_OF_URL));
        assertNull(MathMLContext.of(3, 1).definitionUrls().lookup(ExtendedMathExtension.RATE_OF_URL));
    }

    @Test
    public void testContextIsReusable() {
        MathMLContext context = MathMLContext.of(NamespaceContext.L3V2);
        String xml = "<math xmlns=\"http://www.w3.org/1998/Math/MathML\"><apply><plus/><ci>a</ci><ci>b</ci></apply></math>";

        assertTrue(MathML.parse(xml, context).exactlyEqual(MathML.parse(xml, context)));
        assertEquals(4, context.definitionUrls().size());
    }

    @Test
    public void testInvalidVersion() {
        assertThrows(IllegalArgumentException.class, () -> MathMLContext.of(3, 3));
    }
}
