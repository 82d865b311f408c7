package com.gentoro.kgbridge.importer;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.Test;

class CypherScriptSplitterTest {

  @Test
  void splitsOnTopLevelSemicolons() {
    assertEquals(
        List.of("CREATE (a:A)", "CREATE (b:B)"),
        CypherScriptSplitter.split("CREATE (a:A);\n\n  CREATE (b:B);\n;"));
  }

  @Test
  void keepsSemicolonsInsideQuotes() {
    List<String> statements =
        CypherScriptSplitter.split(
            "CREATE (n {t: 'a;b', u: \"c;d\", v: 'it\\'s;'});"
                + "MATCH (n:`odd;label`) RETURN n;"
                + "CREATE (m:`x``;y`)");
    assertEquals(3, statements.size());
    assertEquals("CREATE (n {t: 'a;b', u: \"c;d\", v: 'it\\'s;'})", statements.get(0));
    assertEquals("MATCH (n:`odd;label`) RETURN n", statements.get(1));
    assertEquals("CREATE (m:`x``;y`)", statements.get(2));
  }

  @Test
  void dropsComments() {
    assertEquals(
        List.of("CREATE (a)", "CREATE  (b)"),
        CypherScriptSplitter.split(
            "// header; with a semicolon\nCREATE (a);\nCREATE /* inline; */(b);\n// trailing"));
  }

  @Test
  void emptyScriptHasNoStatements() {
    assertTrue(CypherScriptSplitter.split("").isEmpty());
    assertTrue(CypherScriptSplitter.split(null).isEmpty());
    assertTrue(CypherScriptSplitter.split(" ;; \n").isEmpty());
  }
}
