package net.ballmerlabs.blemediator.network.bluetoothLE.advertisement;

import org.junit.Test;

import java.util.Arrays;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.notNullValue;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.fail;

public class BleAdvertisementTest {
    private static final String SERVICE_ID = "com.example.service";
    private static final byte[] TOKEN = new byte[]{0x09, 0x08};

    private static BleAdvertisement regular(byte[] data) {
        return BleAdvertisement.newBuilder()
                .setServiceId(SERVICE_ID)
                .setData(data)
                .setDeviceToken(TOKEN)
                .build();
    }

    @Test
    public void regularAdvertisementLayout() {
        final byte[] bytes = regular(new byte[]{1, 2, 3}).getBytes();

        assertThat(bytes.length, is(1 + 3 + 4 + 3 + 2));
        assertThat(bytes[0], is((byte) 0x48));
        assertArrayEquals(BleUtils.generateHash(SERVICE_ID, 3), Arrays.copyOfRange(bytes, 1, 4));
        assertArrayEquals(new byte[]{0, 0, 0, 3}, Arrays.copyOfRange(bytes, 4, 8));
        assertArrayEquals(new byte[]{1, 2, 3}, Arrays.copyOfRange(bytes, 8, 11));
        assertArrayEquals(TOKEN, Arrays.copyOfRange(bytes, 11, 13));
    }

    @Test
    public void fastAdvertisementLayout() {
        final BleAdvertisement advertisement = BleAdvertisement.newBuilder()
                .setFastAdvertisement(true)
                .setData(new byte[]{0x0a, 0x0b, 0x0c, 0x0d})
                .setDeviceToken(TOKEN)
                .build();

        assertArrayEquals(
                new byte[]{0x4A, 0x04, 0x0a, 0x0b, 0x0c, 0x0d, 0x09, 0x08},
                advertisement.getBytes()
        );
        assertThat(advertisement.getServiceIdHash().length, is(0));
    }

    @Test
    public void psmIsAppendedOnlyWhenSet() throws Exception {
        final BleAdvertisement advertisement = BleAdvertisement.newBuilder()
                .setServiceId(SERVICE_ID)
                .setData(new byte[]{1})
                .setDeviceToken(TOKEN)
                .setPsm(0x1234)
                .build();
        final byte[] bytes = advertisement.getBytes();

        assertThat(bytes.length, is(1 + 3 + 4 + 1 + 2 + 2));
        assertThat(bytes[bytes.length - 2], is((byte) 0x12));
        assertThat(bytes[bytes.length - 1], is((byte) 0x34));
        assertThat(BleAdvertisement.parseFrom(bytes).getPsm(), is(0x1234));
        assertThat(BleAdvertisement.parseFrom(regular(new byte[]{1}).getBytes()).getPsm(),
                is(BleAdvertisement.DEFAULT_PSM));
    }

    @Test
    public void decodesRegularAdvertisement() throws Exception {
        final BleAdvertisement parsed = BleAdvertisement.parseFrom(regular(new byte[]{5, 6, 7}).getBytes());

        assertThat(parsed.getVersion(), is(BleAdvertisement.Version.V2));
        assertThat(parsed.getSocketVersion(), is(BleAdvertisement.SocketVersion.V2));
        assertThat(parsed.isFastAdvertisement(), is(false));
        assertArrayEquals(new byte[]{5, 6, 7}, parsed.getData());
        assertArrayEquals(TOKEN, parsed.getDeviceToken());
        assertThat(parsed.matchesServiceId(SERVICE_ID), is(true));
        assertThat(parsed.matchesServiceId("com.example.other"), is(false));
    }

    @Test
    public void acceptsMaximumData() throws Exception {
        final byte[] data = new byte[BleAdvertisement.MAX_DATA_LENGTH];
        Arrays.fill(data, (byte) 0x5A);
        final BleAdvertisement advertisement = regular(data);

        assertThat(advertisement, notNullValue());
        assertArrayEquals(data, BleAdvertisement.parseFrom(advertisement.getBytes()).getData());
    }

    @Test
    public void acceptsDeprecatedVersion() throws Exception {
        final BleAdvertisement advertisement = BleAdvertisement.newBuilder()
                .setVersion(BleAdvertisement.Version.V1)
                .setServiceId(SERVICE_ID)
                .setData(new byte[]{1})
                .build();

        assertThat(BleAdvertisement.parseFrom(advertisement.getBytes()).getVersion(),
                is(BleAdvertisement.Version.V1));
    }

    @Test
    public void generatesDeviceTokenWhenUnset() {
        final BleAdvertisement advertisement = BleAdvertisement.newBuilder()
                .setServiceId(SERVICE_ID)
                .setData(new byte[]{1})
                .build();

        assertThat(advertisement.getDeviceToken().length, is(BleAdvertisement.DEVICE_TOKEN_LENGTH));
    }

    @Test
    public void builderRejectsInvalidInput() {
        assertThat(regular(new byte[0]), nullValue());
        assertThat(regular(null), nullValue());
        assertThat(regular(new byte[BleAdvertisement.MAX_DATA_LENGTH + 1]), nullValue());
        assertThat(BleAdvertisement.newBuilder().setData(new byte[]{1}).build(), nullValue());
        assertThat(BleAdvertisement.newBuilder()
                .setFastAdvertisement(true)
                .setData(new byte[BleAdvertisement.MAX_FAST_DATA_LENGTH + 1])
                .build(), nullValue());
        assertThat(BleAdvertisement.newBuilder()
                .setFastAdvertisement(true)
                .setData(new byte[]{1})
                .setPsm(5)
                .build(), nullValue());
        assertThat(BleAdvertisement.newBuilder()
                .setServiceId(SERVICE_ID)
                .setData(new byte[]{1})
                .setDeviceToken(new byte[]{1})
                .build(), nullValue());
        assertThat(BleAdvertisement.newBuilder()
                .setServiceId(SERVICE_ID)
                .setData(new byte[]{1})
                .setVersion(null)
                .build(), nullValue());
    }

    @Test
    public void rejectsUnknownVersion() {
        final byte[] bytes = regular(new byte[]{1, 2, 3}).getBytes();
        bytes[0] = (byte) ((3 << 5) | (2 << 2));
        assertInvalid(bytes);
    }

    @Test
    public void rejectsTruncatedInput() {
        final byte[] bytes = regular(new byte[]{1, 2, 3}).getBytes();
        assertInvalid(Arrays.copyOf(bytes, bytes.length - 1));
        assertInvalid(Arrays.copyOf(bytes, 2));
        assertInvalid(new byte[0]);
    }

    @Test
    public void rejectsSizeMismatch() {
        final byte[] bytes = regular(new byte[]{1, 2, 3}).getBytes();
        bytes[7] = 100;
        assertInvalid(bytes);
    }

    @Test
    public void rejectsTrailingBytes() {
        final byte[] bytes = BleAdvertisement.newBuilder()
                .setFastAdvertisement(true)
                .setData(new byte[]{1, 2})
                .build()
                .getBytes();
        assertInvalid(Arrays.copyOf(bytes, bytes.length + 1));
    }

    private static void assertInvalid(byte[] bytes) {
        try {
            BleAdvertisement.parseFrom(bytes);
            fail("decoded invalid advertisement");
        } catch (InvalidAdvertisementException expected) {
            // ok
        }
    }
}
