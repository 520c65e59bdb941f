package org.metricshub.formatgen.typing;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThrows;

import org.junit.Test;

public class VarTypeTest {

	@Test
	public void testClassify() {
		assertEquals(VarType.INT, VarType.classify("42"));
		assertEquals(VarType.INT, VarType.classify("-7"));
		assertEquals(VarType.FLOAT, VarType.classify("3.14"));
		assertEquals(VarType.FLOAT, VarType.classify("-0.5"));
		assertEquals(VarType.CHAR, VarType.classify("x"));
		assertEquals(VarType.CHAR, VarType.classify("#"));
		assertEquals(VarType.STRING, VarType.classify("abc"));
		assertEquals(VarType.STRING, VarType.classify("1e5"));
	}

	@Test
	public void testClassifyNothing() {
		assertThrows(TypingException.class, () -> VarType.classify(""));
		assertThrows(TypingException.class, () -> VarType.classify(null));
	}

	@Test
	public void testUnify() {
		assertEquals(VarType.FLOAT, VarType.INT.unify(VarType.FLOAT));
		assertEquals(VarType.STRING, VarType.CHAR.unify(VarType.INT));
		assertEquals(VarType.STRING, VarType.CHAR.unify(VarType.STRING));
		assertEquals(VarType.INT, VarType.INDEX_INT.unify(VarType.INT));
		assertEquals(VarType.QUERY, VarType.QUERY.unify(VarType.QUERY));
		assertEquals(VarType.STRING, VarType.QUERY.unify(VarType.INT));
	}

	@Test
	public void testUnifyIsCommutativeAndAssociative() {
		VarType[] all = VarType.values();
		for (VarType a : all) {
			assertEquals(a, a.unify(a));
			for (VarType b : all) {
				assertEquals(a + "/" + b, a.unify(b), b.unify(a));
				for (VarType c : all) {
					assertEquals(a + "/" + b + "/" + c, a.unify(b).unify(c), a.unify(b.unify(c)));
				}
			}
		}
	}

	@Test
	public void testLabels() {
		assertEquals("index_int", VarType.INDEX_INT.getLabel());
		assertEquals("float", VarType.FLOAT.toString());
	}
}
