package kleene.graph;

import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class IntSetTest {

  @Test
  void equalityIgnoresOrderAndDuplicates() {
    Assertions.assertEquals(IntSet.of(3, 1, 2), IntSet.of(List.of(2, 3, 1, 3)));
    Assertions.assertEquals(IntSet.of(1, 2, 3).hashCode(), IntSet.of(List.of(3, 2, 1)).hashCode());
    Assertions.assertNotEquals(IntSet.of(1, 2), IntSet.of(1, 2, 3));
    Assertions.assertEquals("{1,2,3}", IntSet.of(3, 2, 1, 2).toString());
  }

  @Test
  void membership() {
    final IntSet set = IntSet.of(5, 1, 9);
    Assertions.assertEquals(3, set.size());
    Assertions.assertTrue(set.contains(9));
    Assertions.assertFalse(set.contains(4));
    Assertions.assertTrue(set.intersects(Set.of(4, 5)));
    Assertions.assertFalse(set.intersects(Set.of(2, 3)));
    Assertions.assertTrue(IntSet.of().isEmpty());
    Assertions.assertEquals("{}", IntSet.of().toString());
  }
}
