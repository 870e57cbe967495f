package spwn.frontend.tree;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;

import org.junit.Test;

public class LiteralsTest {

  @Test
  public void testStrContent() {
    assertEquals("hello", Literals.strContent("\"hello\""));
    assertEquals("", Literals.strContent("\"\""));
  }

  /**
   * Embedded quotes are deleted, the backslashes before them stay
   */
  @Test
  public void testStrContentEmbeddedQuote() {
    assertEquals("say \\hi\\", Literals.strContent("\"say \\\"hi\\\"\""));
    assertEquals("a\\nb", Literals.strContent("\"a\\nb\""));
  }

  @Test
  public void testHandleNumber() {
    assertEquals(Integer.valueOf(10), Literals.parseHandleNumber("10"));
    assertEquals(Integer.valueOf(65535), Literals.parseHandleNumber("65535"));
    assertNull(Literals.parseHandleNumber("65536"));
    assertNull(Literals.parseHandleNumber("99999999999999"));
    assertNull(Literals.parseHandleNumber(""));
  }

  @Test
  public void testNumber() {
    assertEquals(1.5, Literals.parseNumber("1.5"), 0.0);
    assertEquals(42.0, Literals.parseNumber("42"), 0.0);
  }
}
