package ca.gc.cra.formdata.domain.tree;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.formdata.domain.part.NamedPart;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.junit.jupiter.api.Test;

class PartTreeTest {
  @Test
  void keyedChildrenUseBareKeyAtTopAndBracketsBelow() {
    PartTree tree = new PartTree.Keyed(List.of(
        new PartTree.Keyed.Entry("name", leaf("Ada")),
        new PartTree.Keyed.Entry("address", new PartTree.Keyed(List.of(
            new PartTree.Keyed.Entry("city", leaf("Ottawa")),
            new PartTree.Keyed.Entry("unit", new PartTree.Keyed(List.of(
                new PartTree.Keyed.Entry("no", leaf("4"))))))))));

    List<NamedPart> parts = tree.namedParts();

    assertEquals(List.of("name", "address[city]", "address[unit][no]"), names(parts));
    assertArrayEquals(bytes("Ottawa"), parts.get(1).body());
  }

  @Test
  void topLevelSequenceIsAlwaysBracketed() {
    PartTree tree = new PartTree.Indexed(List.of(
        new PartTree.Indexed.Slot(0, leaf("a")),
        new PartTree.Indexed.Slot(1, new PartTree.Keyed(List.of(
            new PartTree.Keyed.Entry("id", leaf("7")))))));

    assertEquals(List.of("[0]", "[1][id]"), names(tree.namedParts()));
  }

  @Test
  void slotsKeepTheirSourceIndex() {
    PartTree tree = new PartTree.Keyed(List.of(
        new PartTree.Keyed.Entry("tags", new PartTree.Indexed(List.of(
            new PartTree.Indexed.Slot(0, leaf("a")),
            new PartTree.Indexed.Slot(2, leaf("c")))))));

    assertEquals(List.of("tags[0]", "tags[2]"), names(tree.namedParts()));
  }

  @Test
  void emptyContainersContributeNothing() {
    PartTree tree = new PartTree.Keyed(List.of(
        new PartTree.Keyed.Entry("meta", new PartTree.Keyed(List.of())),
        new PartTree.Keyed.Entry("tags", new PartTree.Indexed(List.of()))));

    assertTrue(tree.namedParts().isEmpty());
  }

  @Test
  void singleCarriesHeadersIntoParts() {
    PartTree tree = new PartTree.Keyed(List.of(
        new PartTree.Keyed.Entry("doc", new PartTree.Single(bytes("%PDF"), "application/pdf", "r.pdf"))));

    NamedPart part = tree.namedParts().get(0);

    assertEquals(new NamedPart("doc", "r.pdf", "application/pdf", bytes("%PDF")), part);
  }

  @Test
  void pathHelpersFollowBracketRules() {
    assertEquals("a", PartTree.keyedPath("", "a"));
    assertEquals("a[b]", PartTree.keyedPath("a", "b"));
    assertEquals("[3]", PartTree.indexedPath("", 3));
    assertEquals("a[b][0]", PartTree.indexedPath("a[b]", 0));
  }

  @Test
  void rejectsNegativeSlotIndex() {
    assertThrows(IllegalArgumentException.class, () -> new PartTree.Indexed.Slot(-1, leaf("x")));
  }

  @Test
  void singleCopiesBody() {
    byte[] body = bytes("abc");
    PartTree.Single single = new PartTree.Single(body, null, null);
    body[0] = 'z';

    assertEquals(new PartTree.Single(bytes("abc"), null, null), single);
  }

  private static PartTree leaf(String text) {
    return new PartTree.Single(bytes(text), null, null);
  }

  private static byte[] bytes(String text) {
    return text.getBytes(StandardCharsets.UTF_8);
  }

  private static List<String> names(List<NamedPart> parts) {
    return parts.stream().map(NamedPart::name).toList();
  }
}
