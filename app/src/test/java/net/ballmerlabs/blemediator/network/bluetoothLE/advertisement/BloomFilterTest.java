package net.ballmerlabs.blemediator.network.bluetoothLE.advertisement;

import org.junit.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertThat;

public class BloomFilterTest {

    @Test
    public void addedItemsAreAlwaysFound() {
        for (int bits : new int[]{1, 2, 7, 8, 9, 80, 81, 4096}) {
            final BloomFilter filter = new BloomFilter(bits);
            final List<String> items = new ArrayList<>();
            for (int i = 0; i < 100; i++) {
                final String item = UUID.randomUUID().toString();
                items.add(item);
                filter.add(item);
            }
            for (String item : items) {
                assertThat("bits=" + bits + " item=" + item, filter.mightContain(item), is(true));
            }
        }
    }

    @Test
    public void emptyFilterContainsNothing() {
        final BloomFilter filter = new BloomFilter(80);
        assertThat(filter.mightContain("com.example.service"), is(false));
        assertArrayEquals(new byte[10], filter.getBytes());
    }

    @Test
    public void byteLengthRoundsUp() {
        assertThat(new BloomFilter(80).getBytes().length, is(10));
        assertThat(new BloomFilter(81).getBytes().length, is(11));
        assertThat(new BloomFilter(1).getBytes().length, is(1));
    }

    @Test
    public void sameItemsGiveSameBytes() {
        final BloomFilter a = new BloomFilter(80);
        final BloomFilter b = new BloomFilter(80);
        a.add("first");
        a.add("second");
        b.add("second");
        b.add("first");
        assertArrayEquals(a.getBytes(), b.getBytes());
    }

    @Test
    public void decodedFilterKeepsMembership() {
        final BloomFilter filter = new BloomFilter(80);
        filter.add("com.example.service");
        filter.add(new byte[]{1, 2, 3});

        final BloomFilter decoded = BloomFilter.fromBytes(filter.getBytes());
        assertThat(decoded.getBitLength(), is(80));
        assertThat(decoded.mightContain("com.example.service"), is(true));
        assertThat(decoded.mightContain(new byte[]{1, 2, 3}), is(true));
        assertArrayEquals(filter.getBytes(), decoded.getBytes());
    }

    @Test
    public void setsAtMostFiveBitsPerItem() {
        final BloomFilter filter = new BloomFilter(80);
        filter.add("only");
        int set = 0;
        for (byte b : filter.getBytes()) {
            set += Integer.bitCount(b & 0xFF);
        }
        assertThat(set >= 1 && set <= 5, is(true));
    }

    @Test(expected = IllegalArgumentException.class)
    public void rejectsZeroBits() {
        new BloomFilter(0);
    }
}
