/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */
package exm.fjc.jsbackend;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

import exm.fjc.ic.tree.ExprKind;
import exm.fjc.ic.tree.TypeIR;

public class JSLoweringTest {

  @Test
  public void testOperators() {
    assertEquals("===", JSLowering.binaryOperator("=="));
    assertEquals("!==", JSLowering.binaryOperator("!="));
    assertEquals("+", JSLowering.binaryOperator("+"));
    assertEquals("Math.trunc(a / b)",
        String.format(JSLowering.BINARY_TEMPLATES.get("~/"), "a", "b"));
  }

  @Test
  public void testTypeChecks() {
    assertEquals("typeof x === 'string'", String.format(
        JSLowering.typeCheckTemplate(TypeIR.STRING), "x"));
    assertEquals("Array.isArray(x)", String.format(
        JSLowering.typeCheckTemplate(TypeIR.generic("List", TypeIR.INT)),
        "x"));
    assertEquals("Type variables always pass", "true",
                 JSLowering.typeCheckTemplate(new TypeIR("T")));
    assertNull("Classes need instanceof",
               JSLowering.typeCheckTemplate(new TypeIR("Widget")));
  }

  @Test
  public void testCasts() {
    assertEquals("Math.floor(%s)", JSLowering.castTemplate(TypeIR.INT));
    assertEquals("%s", JSLowering.castTemplate(TypeIR.DYNAMIC));
    assertEquals("Generic casts are unchecked", "%s",
        JSLowering.castTemplate(TypeIR.generic("Box", TypeIR.INT)));
    assertNull(JSLowering.castTemplate(new TypeIR("Widget")));
  }

  @Test
  public void testQuote() {
    assertEquals("\"plain\"", JSLowering.quote("plain"));
    assertEquals("\"say \\\"hi\\\"\\n\"", JSLowering.quote("say \"hi\"\n"));
    assertEquals("\"a\\\\b\\tc\"", JSLowering.quote("a\\b\tc"));
    assertEquals("\"\\u0001\"", JSLowering.quote("\u0001"));
    assertEquals("Line separators are escaped", "\"\\u2028\"",
                 JSLowering.quote("\u2028"));
  }

  @Test
  public void testTemplateText() {
    assertEquals("cost: \\${x} or $y", JSLowering.templateText(
                                          "cost: ${x} or $y"));
    assertEquals("\\`tick\\`", JSLowering.templateText("`tick`"));
    assertEquals("a\\nb", JSLowering.templateText("a\nb"));
    assertFalse(JSLowering.templateText("\\").equals("\\"));
  }

  @Test
  public void testLooseKinds() {
    assertTrue(JSLowering.LOOSE_KINDS.contains(
        ExprKind.CONDITIONAL));
    assertFalse(JSLowering.LOOSE_KINDS.contains(
        ExprKind.METHOD_CALL));
  }
}
