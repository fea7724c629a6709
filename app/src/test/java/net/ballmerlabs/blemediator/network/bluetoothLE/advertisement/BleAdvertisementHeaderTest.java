package net.ballmerlabs.blemediator.network.bluetoothLE.advertisement;

import org.junit.Test;

import java.util.Arrays;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertThat;

public class BleAdvertisementHeaderTest {
    private static final byte[] BLOOM = new byte[]{1, 2, 3, 4, 5, 6, 7, 8, 9, 10};
    private static final byte[] HASH = new byte[]{(byte) 0xde, (byte) 0xad, (byte) 0xbe, (byte) 0xef};

    private static BleAdvertisementHeader.Builder builder() {
        return BleAdvertisementHeader.newBuilder()
                .setNumSlots(3)
                .setServiceIdBloomFilter(BLOOM)
                .setAdvertisementHash(HASH);
    }

    @Test
    public void headerLayout() {
        final byte[] bytes = builder().setPsm(0x0102).build().getBytes();

        assertThat(bytes.length, is(17));
        assertThat(bytes[0], is((byte) 0x43));
        assertArrayEquals(BLOOM, Arrays.copyOfRange(bytes, 1, 11));
        assertArrayEquals(HASH, Arrays.copyOfRange(bytes, 11, 15));
        assertArrayEquals(new byte[]{1, 2}, Arrays.copyOfRange(bytes, 15, 17));
    }

    @Test
    public void extendedFlag() {
        final byte[] bytes = builder().setExtendedAdvertisement(true).build().getBytes();
        assertThat(bytes[0], is((byte) 0x53));
    }

    @Test
    public void decodesFullHeader() throws Exception {
        final BleAdvertisementHeader header = BleAdvertisementHeader.parseFrom(
                builder().setPsm(0xABCD).build().getBytes());

        assertThat(header.getVersion(), is(BleAdvertisementHeader.Version.V2));
        assertThat(header.isExtendedAdvertisement(), is(false));
        assertThat(header.getNumSlots(), is(3));
        assertArrayEquals(BLOOM, header.getServiceIdBloomFilter());
        assertArrayEquals(HASH, header.getAdvertisementHash());
        assertThat(header.getPsm(), is(0xABCD));
    }

    @Test
    public void decodesHeaderWithoutPsm() throws Exception {
        final byte[] bytes = Arrays.copyOf(builder().setPsm(7).build().getBytes(), 15);
        final BleAdvertisementHeader header = BleAdvertisementHeader.parseFrom(bytes);

        assertThat(header.getPsm(), is(BleAdvertisementHeader.DEFAULT_PSM));
        assertThat(header.getNumSlots(), is(3));
    }

    @Test(expected = InvalidAdvertisementException.class)
    public void rejectsOddLength() throws Exception {
        BleAdvertisementHeader.parseFrom(Arrays.copyOf(builder().build().getBytes(), 16));
    }

    @Test(expected = InvalidAdvertisementException.class)
    public void rejectsUnknownVersion() throws Exception {
        final byte[] bytes = builder().build().getBytes();
        bytes[0] = (byte) (bytes[0] & 0x1F);
        BleAdvertisementHeader.parseFrom(bytes);
    }

    @Test
    public void builderRejectsInvalidFields() {
        assertThat(builder().setNumSlots(16).build(), nullValue());
        assertThat(builder().setNumSlots(-1).build(), nullValue());
        assertThat(builder().setServiceIdBloomFilter(new byte[9]).build(), nullValue());
        assertThat(builder().setAdvertisementHash(new byte[3]).build(), nullValue());
        assertThat(builder().setPsm(0x10000).build(), nullValue());
    }
}
