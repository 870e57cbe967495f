package spwn.frontend;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.List;

import org.antlr.runtime.CommonToken;
import org.junit.Before;
import org.junit.BeforeClass;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import spwn.ast.SpwnAST;
import spwn.ast.antlr.SPWNParser;
import spwn.common.Logging;
import spwn.common.exceptions.NestingDepthException;
import spwn.frontend.tree.Argument;
import spwn.frontend.tree.Definition;
import spwn.frontend.tree.Expression;
import spwn.frontend.tree.HandleClass;
import spwn.frontend.tree.HandleID;
import spwn.frontend.tree.Path;
import spwn.frontend.tree.Statement;
import spwn.frontend.tree.Statement.StatementKind;
import spwn.frontend.tree.ValueLiteral;
import spwn.frontend.tree.Variable;

/**
 * Builds statements from hand-made parse trees, including node types
 * the grammar never produces.
 */
public class TreeBuilderTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  private DiagnosticList diagnostics;
  private TreeBuilder builder;

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging("target/TreeBuilderTest.spwn.log", true);
  }

  @Before
  public void setup() {
    diagnostics = new DiagnosticList();
    builder = new TreeBuilder("test.spwn", diagnostics, 50);
  }

  private static SpwnAST node(int type, String text, int line,
                              SpwnAST... children) {
    CommonToken token = new CommonToken(type, text);
    token.setLine(line);
    SpwnAST tree = new SpwnAST(token);
    for (SpwnAST child: children) {
      tree.addChild(child);
    }
    return tree;
  }

  private static SpwnAST node(int type, String text, SpwnAST... children) {
    return node(type, text, 0, children);
  }

  private static SpwnAST symbolValue(String name) {
    return node(SPWNParser.VARIABLE, "VARIABLE",
              node(SPWNParser.VALUE_LITERAL, "VALUE_LITERAL",
                  node(SPWNParser.SYMBOL, name)));
  }

  private static SpwnAST expr(SpwnAST... children) {
    return node(SPWNParser.EXPRESSION, "EXPRESSION", children);
  }

  private static SpwnAST definition(String name, int line) {
    return node(SPWNParser.DEFINITION, "DEFINITION",
              node(SPWNParser.SYMBOL, name, line),
              expr(symbolValue("v")));
  }

  @Test
  public void testUnknownStatementKind() throws Exception {
    SpwnAST program = node(SPWNParser.PROGRAM, "PROGRAM",
        definition("a", 1),
        node(SPWNParser.LPAREN, "(", 2),
        definition("b", 3),
        node(SPWNParser.END_OF_INPUT, "<EOF>", 3));

    List<Statement> stmts = builder.buildProgram(program);
    assertEquals(4, stmts.size());
    assertEquals(StatementKind.DEFINITION, stmts.get(0).getKind());
    assertEquals("Unknown statement replaced with placeholder",
                 StatementKind.END_OF_INPUT, stmts.get(1).getKind());
    assertEquals("Build continues after unknown statement",
                 "b", stmts.get(2).getDefinition().getSymbol());
    assertEquals(StatementKind.END_OF_INPUT, stmts.get(3).getKind());

    assertEquals(1, diagnostics.size());
    Diagnostic d = diagnostics.get(0);
    assertEquals(Diagnostic.Kind.UNSUPPORTED_CONSTRUCT, d.kind);
    assertEquals(LogHelper.tokName(SPWNParser.LPAREN), d.ruleName);
    assertEquals(2, d.position.line);
    assertEquals("test.spwn", d.position.file);
  }

  @Test
  public void testUnknownValueKind() throws Exception {
    SpwnAST var = node(SPWNParser.VARIABLE, "VARIABLE",
                    node(SPWNParser.VALUE_LITERAL, "VALUE_LITERAL",
                        node(SPWNParser.COMMA, ",")));
    Variable v = builder.variable(var);
    assertEquals(ValueLiteral.number(0), v.getValue());
    assertEquals(1, diagnostics.ofKind(
                  Diagnostic.Kind.UNSUPPORTED_CONSTRUCT).size());
  }

  @Test
  public void testUnknownPathDropped() throws Exception {
    SpwnAST var = node(SPWNParser.VARIABLE, "VARIABLE",
        node(SPWNParser.VALUE_LITERAL, "VALUE_LITERAL",
            node(SPWNParser.SYMBOL, "a")),
        node(SPWNParser.DOT, "."),
        node(SPWNParser.SYMBOL, "b"));
    Variable v = builder.variable(var);
    assertEquals(1, v.getPath().size());
    assertEquals(Path.member("b"), v.getPath().get(0));
    assertEquals(1, diagnostics.size());
  }

  @Test
  public void testWildcardDefinition() throws Exception {
    SpwnAST def = node(SPWNParser.DEFINITION, "DEFINITION",
                       expr(symbolValue("things")));
    Statement stmt = builder.statement(def);
    Definition d = stmt.getDefinition();
    assertTrue(d.isWildcard());
    assertEquals(Definition.WILDCARD, d.getSymbol());
    assertEquals(Expression.of(ValueLiteral.symbol("things")), d.getValue());
    assertTrue(d.getProperties().isEmpty());
  }

  @Test
  public void testArguments() throws Exception {
    SpwnAST args = node(SPWNParser.ARGUMENTS, "(",
        node(SPWNParser.ARGUMENT, "ARGUMENT",
            node(SPWNParser.SYMBOL, "speed"), expr(symbolValue("fast"))),
        node(SPWNParser.ARGUMENT, "ARGUMENT", expr(symbolValue("x"))));
    List<Argument> result = builder.arguments(args);
    assertEquals(2, result.size());
    assertEquals("speed", result.get(0).getName());
    assertEquals(Expression.of(ValueLiteral.symbol("fast")),
                 result.get(0).getValue());
    assertFalse(result.get(1).isKeyword());
    assertEquals(Expression.of(ValueLiteral.symbol("x")),
                 result.get(1).getValue());
  }

  @Test
  public void testHandles() {
    SpwnAST explicit = node(SPWNParser.HANDLE_ID, "10g",
        node(SPWNParser.NUMBER_LIT, "10"), node(SPWNParser.SYMBOL, "g"));
    assertEquals(HandleID.explicit(10, HandleClass.GROUP),
                 builder.handle(explicit));

    SpwnAST unspecified = node(SPWNParser.HANDLE_ID, "?c",
                               node(SPWNParser.SYMBOL, "c"));
    HandleID id = builder.handle(unspecified);
    assertTrue(id.isUnspecified());
    assertEquals(0, id.getNumber());
    assertEquals(HandleClass.COLOR, id.getHandleClass());
    assertTrue(diagnostics.isEmpty());
  }

  @Test
  public void testHandleOutOfRange() {
    SpwnAST tooBig = node(SPWNParser.HANDLE_ID, "70000i",
        node(SPWNParser.NUMBER_LIT, "70000"), node(SPWNParser.SYMBOL, "i"));
    HandleID id = builder.handle(tooBig);
    assertEquals(0, id.getNumber());
    assertFalse(id.isUnspecified());
    assertEquals(HandleClass.ITEM, id.getHandleClass());
    assertEquals(Diagnostic.Kind.INVALID_LITERAL, diagnostics.get(0).kind);
  }

  @Test
  public void testVariableWrapperInValuePosition() throws Exception {
    // Bare variable is unwrapped to its value
    assertEquals(ValueLiteral.symbol("a"),
                 builder.value(symbolValue("a")));

    // Variable with a prefix operator becomes an expression
    SpwnAST negated = node(SPWNParser.VARIABLE, "VARIABLE",
        node(SPWNParser.UNARY_OP, "-"),
        node(SPWNParser.VALUE_LITERAL, "VALUE_LITERAL",
            node(SPWNParser.NUMBER_LIT, "4")));
    ValueLiteral v = builder.value(negated);
    assertEquals(ValueLiteral.Kind.EXPRESSION, v.getKind());
    assertEquals(1, v.getExpression().getValues().size());
  }

  @Test
  public void testReturnWithoutValue() throws Exception {
    Statement stmt = builder.statement(
                      node(SPWNParser.RETURN_STMT, "return", 4));
    assertEquals(StatementKind.RETURN, stmt.getKind());
    assertEquals(Expression.of(ValueLiteral.nullValue()),
                 stmt.getExpression());
    assertEquals(4, stmt.getStartLine());
  }

  @Test
  public void testContextFork() throws Exception {
    Statement stmt = builder.statement(
        node(SPWNParser.CONTEXT_FORK, "CONTEXT_FORK", definition("a", 1)));
    assertEquals(StatementKind.DEFINITION, stmt.getKind());
    assertTrue(stmt.isContextFork());
  }

  @Test
  public void testDepthLimit() throws Exception {
    // One level per parenthesized expression, limit is 50
    builder.expression(expr(parenthesized(symbolValue("x"), 45)));

    exception.expect(NestingDepthException.class);
    builder.expression(expr(parenthesized(symbolValue("x"), 55)));
  }

  private static SpwnAST parenthesized(SpwnAST tree, int levels) {
    for (int i = 0; i < levels; i++) {
      tree = node(SPWNParser.VARIABLE, "VARIABLE",
                node(SPWNParser.VALUE_LITERAL, "VALUE_LITERAL",
                    expr(tree)));
    }
    return tree;
  }
}
