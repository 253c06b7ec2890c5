package com.example.arithmetic;

import org.junit.Test;
import static org.junit.Assert.assertEquals;

public class AdditionTest {
    @Test
    public void testAdd() {
        assertEquals(8, Addition.add(3, 5));
        assertEquals(0, Addition.add(0, 0));
        assertEquals(-2, Addition.add(3, -5));
        assertEquals(-10, Addition.add(-4, -6));
        assertEquals(Integer.MAX_VALUE, Addition.add(Integer.MAX_VALUE, 0));
    }

    @Test
    public void testAddWraps() {
        assertEquals(Integer.MIN_VALUE, Addition.add(Integer.MAX_VALUE, 1));
        assertEquals(Integer.MAX_VALUE, Addition.add(Integer.MIN_VALUE, -1));
    }

    @Test
    public void testDescribe() {
        assertEquals("La somma di 3 e 5 è: 8", Addition.describe(3, 5));
        assertEquals("La somma di -7 e 2 è: -5", Addition.describe(-7, 2));
    }
}
