package org.dxworks.uischema.analyzer;

import org.dxworks.uischema.model.CanonicalType;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class TypeMapperTest {

    @Test
    void missingAnnotationIsText() {
        assertEquals(CanonicalType.TEXT, TypeMapper.map(null));
        assertEquals(CanonicalType.TEXT, TypeMapper.map("   "));
    }

    @Test
    void primitivesMapToTheirKinds() {
        assertEquals(CanonicalType.TEXT, TypeMapper.map("string"));
        assertEquals(CanonicalType.NUMBER, TypeMapper.map("number"));
        assertEquals(CanonicalType.BOOLEAN, TypeMapper.map("boolean"));
        assertEquals(CanonicalType.BOOLEAN, TypeMapper.map("PropTypes.bool"));
    }

    @Test
    void functionShapesWinOverEverythingElse() {
        assertEquals(CanonicalType.FUNCTION, TypeMapper.map("() => void"));
        assertEquals(CanonicalType.FUNCTION, TypeMapper.map("(items: string[]) => void"));
        assertEquals(CanonicalType.FUNCTION, TypeMapper.map("Function"));
        assertEquals(CanonicalType.FUNCTION, TypeMapper.map("func"));
        assertEquals(CanonicalType.FUNCTION, TypeMapper.map("MouseEventHandler"));
    }

    @Test
    void arraysAreCheckedBeforeElementTypes() {
        assertEquals(CanonicalType.ARRAY, TypeMapper.map("string[]"));
        assertEquals(CanonicalType.ARRAY, TypeMapper.map("Array<number>"));
        assertEquals(CanonicalType.ARRAY, TypeMapper.map("ReactNode[]"));
    }

    @Test
    void arraysOfFunctionsAreArrays() {
        assertEquals(CanonicalType.ARRAY, TypeMapper.map("Function[]"));
        assertEquals(CanonicalType.ARRAY, TypeMapper.map("Array<Function>"));
        assertEquals(CanonicalType.ARRAY, TypeMapper.map("(() => void)[]"));
        assertEquals(CanonicalType.ARRAY, TypeMapper.map("ReadonlyArray<(id: number) => void>"));
        assertEquals(CanonicalType.FUNCTION, TypeMapper.map("() => string[]"));
    }

    @Test
    void elementResourceColorAndDimension() {
        assertEquals(CanonicalType.ELEMENT, TypeMapper.map("React.ReactNode"));
        assertEquals(CanonicalType.ELEMENT, TypeMapper.map("JSX.Element"));
        assertEquals(CanonicalType.RESOURCE, TypeMapper.map("ImageSourcePropType"));
        assertEquals(CanonicalType.COLOR, TypeMapper.map("ColorValue"));
        assertEquals(CanonicalType.DIMENSION, TypeMapper.map("DimensionValue"));
    }

    @Test
    void nodeMustBeAWholeWord() {
        assertEquals(CanonicalType.ELEMENT, TypeMapper.map("PropTypes.node"));
        assertEquals(CanonicalType.TEXT, TypeMapper.map("NodeJS.Timeout"));
        assertEquals(CanonicalType.TEXT, TypeMapper.map("NodeId"));
    }

    @Test
    void objectShapes() {
        assertEquals(CanonicalType.OBJECT, TypeMapper.map("{ x: number; y: number }"));
        assertEquals(CanonicalType.OBJECT, TypeMapper.map("Record<string, unknown>"));
        assertEquals(CanonicalType.OBJECT, TypeMapper.map("ViewStyle"));
        assertEquals(CanonicalType.OBJECT, TypeMapper.map("Object"));
    }

    @Test
    void unknownAnnotationsFallBackToText() {
        assertEquals(CanonicalType.TEXT, TypeMapper.map("'primary' | 'secondary'"));
        assertEquals(CanonicalType.TEXT, TypeMapper.map("Size"));
    }
}
