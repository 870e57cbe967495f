package spwn.frontend;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.File;
import java.util.List;

import org.junit.BeforeClass;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import spwn.common.Logging;
import spwn.common.exceptions.InvalidSyntaxException;
import spwn.common.exceptions.ModuleLoadException;
import spwn.common.exceptions.NestingDepthException;
import spwn.common.util.Pair;
import spwn.frontend.tree.ArgDef;
import spwn.frontend.tree.Argument;
import spwn.frontend.tree.DictDef;
import spwn.frontend.tree.Expression;
import spwn.frontend.tree.ForLoop;
import spwn.frontend.tree.HandleClass;
import spwn.frontend.tree.HandleID;
import spwn.frontend.tree.If;
import spwn.frontend.tree.Implementation;
import spwn.frontend.tree.Macro;
import spwn.frontend.tree.Operator;
import spwn.frontend.tree.Path;
import spwn.frontend.tree.Statement;
import spwn.frontend.tree.Statement.StatementKind;
import spwn.frontend.tree.UnaryOperator;
import spwn.frontend.tree.ValueLiteral;
import spwn.frontend.tree.Variable;

/**
 * Parses SPWN source text and checks the statements built from it
 */
public class ParsedModuleTest {

  private static final int MAX_DEPTH = 200;

  @Rule
  public ExpectedException exception = ExpectedException.none();

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging("target/ParsedModuleTest.spwn.log", true);
  }

  private static List<Statement> parse(String source) throws Exception {
    ParsedModule module = ParsedModule.parseString("test.spwn", source,
                                                   MAX_DEPTH);
    assertTrue("Unexpected diagnostics: " + module.diagnostics.getDiagnostics(),
               module.diagnostics.isEmpty());
    List<Statement> stmts = module.statements;
    assertEquals("Program should end with END_OF_INPUT",
        StatementKind.END_OF_INPUT, stmts.get(stmts.size() - 1).getKind());
    for (Statement stmt: stmts) {
      checkInvariant(stmt);
    }
    return stmts;
  }

  /**
   * Value of the single definition in source
   */
  private static Expression definedValue(String source) throws Exception {
    List<Statement> stmts = parse(source);
    assertEquals(2, stmts.size());
    return stmts.get(0).getDefinition().getValue();
  }

  private static ValueLiteral singleValue(Expression e) {
    assertTrue("Expected single operand: " + e, e.isSingleValue());
    Variable v = e.getValues().get(0);
    assertTrue("Expected bare operand: " + v, v.isBare());
    return v.getValue();
  }

  private static Expression symbol(String name) {
    return Expression.of(ValueLiteral.symbol(name));
  }

  private static Expression number(double n) {
    return Expression.of(ValueLiteral.number(n));
  }

  /**
   * Operands and operators match up in every nested expression
   */
  private static void checkInvariant(Object node) {
    if (node instanceof Statement) {
      Statement stmt = (Statement)node;
      switch (stmt.getKind()) {
        case DEFINITION:
          checkInvariant(stmt.getDefinition().getValue());
          break;
        case CALL:
          checkInvariant(stmt.getCall().getFunction());
          break;
        case EXPRESSION:
        case RETURN:
        case EXTRACT:
        case ADD_OBJECT:
          checkInvariant(stmt.getExpression());
          break;
        case IF:
          checkInvariant(stmt.getIf().getCondition());
          checkAll(stmt.getIf().getIfBody());
          if (stmt.getIf().hasElse()) {
            checkAll(stmt.getIf().getElseBody());
          }
          break;
        case FOR:
          checkInvariant(stmt.getForLoop().getArray());
          checkAll(stmt.getForLoop().getBody());
          break;
        case IMPL:
          checkInvariant(stmt.getImpl().getSymbol());
          for (DictDef d: stmt.getImpl().getMembers()) {
            checkInvariant(d.getValue());
          }
          break;
        case ERROR:
          checkInvariant(stmt.getError().getMessage());
          break;
        default:
          break;
      }
    } else if (node instanceof Expression) {
      Expression e = (Expression)node;
      assertEquals(e.getOperators().size() + 1, e.getValues().size());
      checkAll(e.getValues());
    } else if (node instanceof Variable) {
      Variable v = (Variable)node;
      checkInvariant(v.getValue());
      for (Path p: v.getPath()) {
        if (p.getKind() == Path.Kind.INDEX) {
          checkInvariant(p.getIndex());
        } else if (p.getKind() == Path.Kind.CALL) {
          for (Argument a: p.getArguments()) {
            checkInvariant(a.getValue());
          }
        }
      }
    } else if (node instanceof ValueLiteral) {
      ValueLiteral v = (ValueLiteral)node;
      switch (v.getKind()) {
        case EXPRESSION:
          checkInvariant(v.getExpression());
          break;
        case ARRAY:
          checkAll(v.getArray());
          break;
        case COMPOUND_STATEMENT:
          checkAll(v.getCompoundStatement().getStatements());
          break;
        case MACRO:
          checkAll(v.getMacro().getBody().getStatements());
          for (ArgDef a: v.getMacro().getArgs()) {
            if (a.getDefaultValue() != null) {
              checkInvariant(a.getDefaultValue());
            }
          }
          break;
        case DICTIONARY:
          for (DictDef d: v.getDictionary()) {
            checkInvariant(d.getValue());
          }
          break;
        case OBJECT:
          for (Pair<Expression, Expression> p: v.getObject()) {
            checkInvariant(p.val1);
            checkInvariant(p.val2);
          }
          break;
        default:
          break;
      }
    }
  }

  private static void checkAll(List<?> nodes) {
    for (Object node: nodes) {
      checkInvariant(node);
    }
  }

  @Test
  public void testEmptyProgram() throws Exception {
    List<Statement> stmts = parse("");
    assertEquals(1, stmts.size());
  }

  @Test
  public void testExplicitHandle() throws Exception {
    ValueLiteral v = singleValue(definedValue("a = 10g"));
    assertEquals(ValueLiteral.Kind.HANDLE_ID, v.getKind());
    HandleID id = v.getHandle();
    assertEquals(10, id.getNumber());
    assertFalse(id.isUnspecified());
    assertEquals(HandleClass.GROUP, id.getHandleClass());
  }

  @Test
  public void testUnspecifiedHandle() throws Exception {
    HandleID id = singleValue(definedValue("a = ?g")).getHandle();
    assertEquals(0, id.getNumber());
    assertTrue(id.isUnspecified());
    assertEquals(HandleClass.GROUP, id.getHandleClass());

    assertEquals(HandleClass.BLOCK,
                 singleValue(definedValue("b = ?b")).getHandle().getHandleClass());
  }

  @Test
  public void testHandleOutOfRange() throws Exception {
    ParsedModule module = ParsedModule.parseString("test.spwn",
                                      "a = 70000c", MAX_DEPTH);
    assertEquals(1, module.diagnostics.size());
    assertEquals(Diagnostic.Kind.INVALID_LITERAL,
                 module.diagnostics.get(0).kind);
    HandleID id = singleValue(module.statements.get(0).getDefinition()
                              .getValue()).getHandle();
    assertEquals(0, id.getNumber());
    assertEquals(HandleClass.COLOR, id.getHandleClass());
  }

  @Test
  public void testLiterals() throws Exception {
    assertEquals(ValueLiteral.string("hello"),
                 singleValue(definedValue("s = \"hello\"")));
    assertEquals(ValueLiteral.number(1.5),
                 singleValue(definedValue("n = 1.5")));
    assertEquals(ValueLiteral.bool(false),
                 singleValue(definedValue("b = false")));
    assertEquals(ValueLiteral.nullValue(),
                 singleValue(definedValue("z = null")));
    assertEquals(ValueLiteral.typeIndicator("number"),
                 singleValue(definedValue("t = @number")));
  }

  /**
   * Embedded quotes are deleted rather than unescaped
   */
  @Test
  public void testStringEmbeddedQuote() throws Exception {
    ValueLiteral v = singleValue(definedValue("s = \"say \\\"hi\\\"\""));
    assertEquals("say \\hi\\", v.getString());
  }

  @Test
  public void testPathChain() throws Exception {
    List<Statement> stmts = parse("foo.bar[0](x)");
    assertEquals(2, stmts.size());
    assertEquals(StatementKind.CALL, stmts.get(0).getKind());
    Variable fn = stmts.get(0).getCall().getFunction();
    assertEquals(ValueLiteral.symbol("foo"), fn.getValue());
    assertNull(fn.getOperator());
    List<Path> path = fn.getPath();
    assertEquals(3, path.size());
    assertEquals(Path.member("bar"), path.get(0));
    assertEquals(Path.index(number(0)), path.get(1));
    assertEquals(Path.Kind.CALL, path.get(2).getKind());
    List<Argument> args = path.get(2).getArguments();
    assertEquals(1, args.size());
    assertEquals(Argument.positional(symbol("x")), args.get(0));
  }

  @Test
  public void testKeywordArguments() throws Exception {
    List<Statement> stmts = parse("spawn(group, delay = 2)");
    List<Argument> args = stmts.get(0).getCall().getFunction()
                                .getPath().get(0).getArguments();
    assertEquals(Argument.positional(symbol("group")), args.get(0));
    assertEquals(Argument.keyword("delay", number(2)), args.get(1));
  }

  @Test
  public void testPathNotCallIsExpression() throws Exception {
    List<Statement> stmts = parse("foo.bar");
    assertEquals(StatementKind.EXPRESSION, stmts.get(0).getKind());
  }

  @Test
  public void testMacroDefinition() throws Exception {
    ValueLiteral v = singleValue(definedValue("m = (a, b = 5) {}"));
    assertEquals(ValueLiteral.Kind.MACRO, v.getKind());
    Macro macro = v.getMacro();
    assertEquals(2, macro.getArgs().size());
    assertEquals(ArgDef.required("a"), macro.getArgs().get(0));
    ArgDef b = macro.getArgs().get(1);
    assertEquals("b", b.getName());
    assertEquals(number(5), b.getDefaultValue());
    assertNull(b.getType());
    assertTrue(macro.getBody().getStatements().isEmpty());
  }

  @Test
  public void testMacroTypedArgument() throws Exception {
    Macro macro = singleValue(definedValue(
          "m = (g: @group, n: @number = 1) { return n }")).getMacro();
    assertEquals(Expression.of(ValueLiteral.typeIndicator("group")),
                 macro.getArgs().get(0).getType());
    assertEquals(number(1), macro.getArgs().get(1).getDefaultValue());
    List<Statement> body = macro.getBody().getStatements();
    assertEquals(1, body.size());
    assertEquals(StatementKind.RETURN, body.get(0).getKind());
    assertEquals(symbol("n"), body.get(0).getExpression());
  }

  @Test
  public void testDescriptionTag() throws Exception {
    List<Statement> stmts = parse(
        "#[desc(\"Moves a group\")] move = (g) { g.move(1, 0) }");
    assertEquals("Moves a group",
                 stmts.get(0).getDefinition().getProperties().getDesc());
  }

  @Test
  public void testReturnWithoutValue() throws Exception {
    Macro macro = singleValue(definedValue("f = () { return }")).getMacro();
    Statement ret = macro.getBody().getStatements().get(0);
    assertEquals(StatementKind.RETURN, ret.getKind());
    assertEquals(Expression.of(ValueLiteral.nullValue()), ret.getExpression());
  }

  @Test
  public void testPrecedence() throws Exception {
    Expression e = definedValue("x = 1 + 2 * 3");
    assertEquals(2, e.getValues().size());
    assertEquals(Operator.PLUS, e.getOperators().get(0));
    assertEquals(ValueLiteral.number(1), e.getValues().get(0).getValue());

    ValueLiteral nested = e.getValues().get(1).getValue();
    assertEquals("Higher precedence chain nested as parenthesized operand",
                 ValueLiteral.Kind.EXPRESSION, nested.getKind());
    Expression product = nested.getExpression();
    assertEquals(1, product.getOperators().size());
    assertEquals(Operator.MULTIPLY, product.getOperators().get(0));
  }

  @Test
  public void testSameTierIsFlat() throws Exception {
    Expression e = definedValue("x = a - b + c");
    assertEquals(3, e.getValues().size());
    assertEquals(Operator.MINUS, e.getOperators().get(0));
    assertEquals(Operator.PLUS, e.getOperators().get(1));
  }

  @Test
  public void testParentheses() throws Exception {
    Expression e = definedValue("x = (1 + 2) * 3");
    assertEquals(Operator.MULTIPLY, e.getOperators().get(0));
    Expression sum = e.getValues().get(0).getValue().getExpression();
    assertEquals(Operator.PLUS, sum.getOperators().get(0));
  }

  @Test
  public void testUnaryOperators() throws Exception {
    Variable not = definedValue("x = !a").getValues().get(0);
    assertEquals(UnaryOperator.NOT, not.getOperator());
    assertEquals(ValueLiteral.symbol("a"), not.getValue());

    Variable neg = definedValue("y = -5").getValues().get(0);
    assertEquals(UnaryOperator.NEGATE, neg.getOperator());

    Variable range = definedValue("z = ..10").getValues().get(0);
    assertEquals(UnaryOperator.RANGE_FROM, range.getOperator());
  }

  @Test
  public void testAssignmentOperator() throws Exception {
    List<Statement> stmts = parse("counter += 1");
    assertEquals(StatementKind.EXPRESSION, stmts.get(0).getKind());
    Expression e = stmts.get(0).getExpression();
    assertEquals(Operator.ADD_ASSIGN, e.getOperators().get(0));
  }

  @Test
  public void testIfElseChain() throws Exception {
    List<Statement> stmts = parse(
        "if a == 1 {\n" +
        "  b = 1\n" +
        "} else if a == 2 {\n" +
        "  b = 2\n" +
        "} else {\n" +
        "  b = 3\n" +
        "}\n");
    assertEquals(2, stmts.size());
    If first = stmts.get(0).getIf();
    assertEquals(Operator.EQUAL, first.getCondition().getOperators().get(0));
    assertEquals(1, first.getIfBody().size());
    assertTrue(first.hasElse());
    assertEquals(1, first.getElseBody().size());

    If second = first.getElseBody().get(0).getIf();
    assertEquals("b", second.getIfBody().get(0).getDefinition().getSymbol());
    assertEquals(number(3),
        second.getElseBody().get(0).getDefinition().getValue());
  }

  @Test
  public void testIfWithoutElse() throws Exception {
    If stmt = parse("if done { return }").get(0).getIf();
    assertFalse(stmt.hasElse());
    assertNull(stmt.getElseBody());
  }

  @Test
  public void testForLoop() throws Exception {
    List<Statement> stmts = parse("for i in 0..10 { total += i }");
    ForLoop loop = stmts.get(0).getForLoop();
    assertEquals("i", loop.getSymbol());
    assertEquals(Operator.RANGE, loop.getArray().getOperators().get(0));
    assertEquals(1, loop.getBody().size());
    assertEquals(StatementKind.EXPRESSION, loop.getBody().get(0).getKind());
  }

  @Test
  public void testImpl() throws Exception {
    List<Statement> stmts = parse(
        "impl @dog {\n" +
        "  bark: (self) { return \"woof\" },\n" +
        "  legs: 4,\n" +
        "}\n");
    Implementation impl = stmts.get(0).getImpl();
    assertEquals(ValueLiteral.typeIndicator("dog"),
                 impl.getSymbol().getValue());
    assertEquals(2, impl.getMembers().size());
    assertEquals("bark", impl.getMembers().get(0).getName());
    assertEquals(ValueLiteral.Kind.MACRO,
        singleValue(impl.getMembers().get(0).getValue()).getKind());
    assertEquals(DictDef.def("legs", number(4)), impl.getMembers().get(1));
  }

  @Test
  public void testDictionary() throws Exception {
    ValueLiteral v = singleValue(definedValue("d = {a: 1, ..other}"));
    List<DictDef> entries = v.getDictionary();
    assertEquals(2, entries.size());
    assertEquals(DictDef.def("a", number(1)), entries.get(0));
    assertEquals(DictDef.Kind.EXTRACT, entries.get(1).getKind());
    assertEquals(symbol("other"), entries.get(1).getValue());
  }

  @Test
  public void testArrayAndObject() throws Exception {
    ValueLiteral arr = singleValue(definedValue("a = [1, 2, 3]"));
    assertEquals(3, arr.getArray().size());
    assertEquals(number(2), arr.getArray().get(1));

    ValueLiteral obj = singleValue(definedValue("o = obj { x: 10, y: 20 }"));
    List<Pair<Expression, Expression>> props = obj.getObject();
    assertEquals(2, props.size());
    assertEquals(Pair.create(symbol("x"), number(10)), props.get(0));
  }

  @Test
  public void testImport() throws Exception {
    ValueLiteral v = singleValue(definedValue("lib = import \"lib/util.spwn\""));
    assertEquals(new File("lib/util.spwn"), v.getImport());
  }

  @Test
  public void testTriggerFunction() throws Exception {
    ValueLiteral v = singleValue(definedValue("t = !{ 10g.move(1, 0) }"));
    assertEquals(ValueLiteral.Kind.COMPOUND_STATEMENT, v.getKind());
    List<Statement> body = v.getCompoundStatement().getStatements();
    assertEquals(1, body.size());
    assertEquals(StatementKind.CALL, body.get(0).getKind());
    assertEquals(HandleID.explicit(10, HandleClass.GROUP),
        body.get(0).getCall().getFunction().getValue().getHandle());
  }

  @Test
  public void testOtherStatements() throws Exception {
    List<Statement> stmts = parse(
        "type @dog\n" +
        "add obj { a: 1 }\n" +
        "error \"bad\"\n" +
        "extract lib\n" +
        "let things\n");
    assertEquals(6, stmts.size());
    assertEquals("dog", stmts.get(0).getTypeName());
    assertEquals(StatementKind.ADD_OBJECT, stmts.get(1).getKind());
    assertEquals(Expression.of(ValueLiteral.string("bad")),
                 stmts.get(2).getError().getMessage());
    assertEquals(symbol("lib"), stmts.get(3).getExpression());
    assertTrue(stmts.get(4).getDefinition().isWildcard());
  }

  @Test
  public void testContextFork() throws Exception {
    List<Statement> stmts = parse("-> spawn(1g)\nspawn(2g)");
    assertEquals(3, stmts.size());
    assertTrue(stmts.get(0).isContextFork());
    assertEquals(StatementKind.CALL, stmts.get(0).getKind());
    assertFalse(stmts.get(1).isContextFork());
  }

  @Test
  public void testSemicolonsAndComments() throws Exception {
    List<Statement> stmts = parse(
        "// setup\n" +
        "a = 1; b = 2;\n" +
        "/* block\n comment */ c = 3\n");
    assertEquals(4, stmts.size());
    assertEquals("c", stmts.get(2).getDefinition().getSymbol());
  }

  @Test
  public void testLineSpans() throws Exception {
    List<Statement> stmts = parse(
        "a = 1\n" +
        "b = (x) {\n" +
        "  return x\n" +
        "}\n");
    assertEquals(1, stmts.get(0).getStartLine());
    assertEquals(1, stmts.get(0).getEndLine());
    assertEquals(2, stmts.get(1).getStartLine());
    assertEquals(3, stmts.get(1).getEndLine());
  }

  @Test
  public void testUnbalancedBraces() throws Exception {
    exception.expect(InvalidSyntaxException.class);
    ParsedModule.parseString("bad.spwn", "f = (a) {\n  b = 1\n", MAX_DEPTH);
  }

  @Test
  public void testExtraBrace() throws Exception {
    try {
      ParsedModule.parseString("bad.spwn", "a = 1\n}\nb = 2", MAX_DEPTH);
      fail("Expected syntax error");
    } catch (InvalidSyntaxException e) {
      assertFalse(e.getParserMessages().isEmpty());
      assertTrue(e.getMessage(), e.getMessage().startsWith("bad.spwn:2:"));
    }
  }

  @Test
  public void testHandleRunIntoName() throws Exception {
    for (String source: new String[] {"a = 10gx", "b = 3items", "c = ?b2"}) {
      try {
        ParsedModule.parseString("bad.spwn", source, MAX_DEPTH);
        fail("Expected syntax error for " + source);
      } catch (InvalidSyntaxException e) {
        assertTrue(e.getMessage(), e.getMessage().startsWith("bad.spwn:1:"));
      }
    }
  }

  @Test
  public void testKeywordMemberNames() throws Exception {
    List<Statement> stmts = parse("$.add(obj { 1: 2 })");
    assertEquals(StatementKind.CALL, stmts.get(0).getKind());
    Variable fn = stmts.get(0).getCall().getFunction();
    assertEquals(ValueLiteral.symbol("$"), fn.getValue());
    assertEquals(Path.member("add"), fn.getPath().get(0));
    List<Argument> args = fn.getPath().get(1).getArguments();
    assertEquals(ValueLiteral.Kind.OBJECT,
                 singleValue(args.get(0).getValue()).getKind());

    Variable member = definedValue("x = a.type").getValues().get(0);
    assertEquals(ValueLiteral.symbol("a"), member.getValue());
    assertEquals(Path.member("type"), member.getPath().get(0));
  }

  /**
   * A parameter-list shaped condition is read as a macro, leaving the
   * if statement without a body
   */
  @Test
  public void testParenthesizedIfCondition() throws Exception {
    exception.expect(InvalidSyntaxException.class);
    ParsedModule.parseString("if.spwn", "if (ready) { a = 1 }", MAX_DEPTH);
  }

  @Test
  public void testMissingFile() throws Exception {
    exception.expect(ModuleLoadException.class);
    ParsedModule.parse("does/not/exist.spwn", MAX_DEPTH);
  }

  @Test
  public void testDepthLimit() throws Exception {
    StringBuilder source = new StringBuilder("x = ");
    for (int i = 0; i < 12; i++) {
      source.append('(');
    }
    source.append('1');
    for (int i = 0; i < 12; i++) {
      source.append(')');
    }
    // Within the default limit
    parse(source.toString());

    exception.expect(NestingDepthException.class);
    ParsedModule.parseString("deep.spwn", source.toString(), 10);
  }

  /**
   * Top level block, definition value, then one level per parenthesis
   */
  @Test
  public void testDepthCountsSourceNesting() throws Exception {
    ParsedModule module = ParsedModule.parseString("nest.spwn",
                                                   "x = ((1))", 4);
    assertEquals(number(1), module.statements.get(0).getDefinition()
        .getValue().getValues().get(0).getValue().getExpression()
        .getValues().get(0).getValue().getExpression());

    exception.expect(NestingDepthException.class);
    ParsedModule.parseString("nest.spwn", "x = ((1))", 3);
  }

  @Test
  public void testParserOverflowPosition() throws Exception {
    StringBuilder source = new StringBuilder("a = 1\nb = 2\nx = ");
    for (int i = 0; i < 50000; i++) {
      source.append('(');
    }
    try {
      ParsedModule.parseString("deep.spwn", source.toString(), MAX_DEPTH);
      fail("Expected nesting error");
    } catch (NestingDepthException e) {
      assertTrue(e.getMessage(), e.getMessage().startsWith("deep.spwn:3:"));
    }
  }

  @Test
  public void testExampleFile() throws Exception {
    File file = new File(getClass().getResource("/spwn/example.spwn").toURI());
    ParsedModule module = ParsedModule.parse(file.getPath(), MAX_DEPTH);
    assertTrue(module.diagnostics.isEmpty());
    checkAll(module.statements);
    assertEquals(StatementKind.END_OF_INPUT,
        module.statements.get(module.statements.size() - 1).getKind());
    assertEquals(file.getPath(), module.inputFilePath);
    assertTrue(module.statements.size() > 5);
  }
}
