package net.ballmerlabs.blemediator.network.bluetoothLE.advertisement;

import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.util.Arrays;

/**
 * Medium-level wrapper around the bytes a caller advertises for one service id.
 *
 * <p>Layout: one byte holding version, socket version and the fast flag, then
 * for regular advertisements the service id hash and a 4 byte data size, or
 * for fast advertisements a 1 byte data size. Data and device token follow;
 * regular advertisements append a 2 byte psm when it is not the default.
 */
public class BleAdvertisement implements BleSerializable {
    public static final int SERVICE_ID_HASH_LENGTH = 3;
    public static final int DEVICE_TOKEN_LENGTH = 2;
    public static final int MAX_DATA_LENGTH = 512;
    public static final int MAX_FAST_DATA_LENGTH = 0xFF;
    public static final int DEFAULT_PSM = 0;
    private static final int MAX_PSM = 0xFFFF;
    private static final int HEADER_BYTE_LENGTH = 1;
    private static final int DATA_SIZE_LENGTH = 4;
    private static final int FAST_DATA_SIZE_LENGTH = 1;
    private static final int PSM_LENGTH = 2;
    private static final int FAST_FLAG = 0x02;

    public enum Version {
        V1(1),
        V2(2);

        private final int val;

        Version(int val) {
            this.val = val;
        }

        public int getVal() {
            return val;
        }

        static Version fromVal(int val) {
            for (Version v : values()) {
                if (v.val == val) {
                    return v;
                }
            }
            return null;
        }
    }

    public enum SocketVersion {
        V1(1),
        V2(2);

        private final int val;

        SocketVersion(int val) {
            this.val = val;
        }

        public int getVal() {
            return val;
        }

        static SocketVersion fromVal(int val) {
            for (SocketVersion v : values()) {
                if (v.val == val) {
                    return v;
                }
            }
            return null;
        }
    }

    private final Version version;
    private final SocketVersion socketVersion;
    private final boolean fastAdvertisement;
    private final byte[] serviceIdHash;
    private final byte[] data;
    private final byte[] deviceToken;
    private final int psm;

    private BleAdvertisement(
            Version version,
            SocketVersion socketVersion,
            boolean fastAdvertisement,
            byte[] serviceIdHash,
            byte[] data,
            byte[] deviceToken,
            int psm
    ) {
        this.version = version;
        this.socketVersion = socketVersion;
        this.fastAdvertisement = fastAdvertisement;
        this.serviceIdHash = serviceIdHash;
        this.data = data;
        this.deviceToken = deviceToken;
        this.psm = psm;
    }

    /**
     * Decodes an advertisement read from a scan response or a GATT slot.
     *
     * @param bytes encoded advertisement
     * @return the advertisement
     * @throws InvalidAdvertisementException if the bytes are truncated, carry an
     *                                       unknown version, or disagree with their size field
     */
    public static BleAdvertisement parseFrom(byte[] bytes) throws InvalidAdvertisementException {
        if (bytes == null || bytes.length < HEADER_BYTE_LENGTH) {
            throw new InvalidAdvertisementException("advertisement is empty");
        }
        final ByteBuffer buffer = ByteBuffer.wrap(bytes);
        final int first = buffer.get() & 0xFF;
        final Version version = Version.fromVal((first >> 5) & 0x07);
        if (version == null) {
            throw new InvalidAdvertisementException("unsupported advertisement version " + ((first >> 5) & 0x07));
        }
        final SocketVersion socketVersion = SocketVersion.fromVal((first >> 2) & 0x07);
        if (socketVersion == null) {
            throw new InvalidAdvertisementException("unsupported socket version " + ((first >> 2) & 0x07));
        }
        final boolean fast = (first & FAST_FLAG) != 0;

        try {
            final byte[] serviceIdHash;
            final int dataSize;
            if (fast) {
                serviceIdHash = new byte[0];
                dataSize = buffer.get() & 0xFF;
            } else {
                serviceIdHash = new byte[SERVICE_ID_HASH_LENGTH];
                buffer.get(serviceIdHash);
                dataSize = buffer.getInt();
            }
            final int maxData = fast ? MAX_FAST_DATA_LENGTH : MAX_DATA_LENGTH;
            if (dataSize <= 0 || dataSize > maxData || dataSize > buffer.remaining()) {
                throw new InvalidAdvertisementException("invalid data size " + dataSize);
            }
            final byte[] data = new byte[dataSize];
            buffer.get(data);
            final byte[] deviceToken = new byte[DEVICE_TOKEN_LENGTH];
            buffer.get(deviceToken);

            int psm = DEFAULT_PSM;
            if (!fast && buffer.remaining() >= PSM_LENGTH) {
                psm = buffer.getShort() & 0xFFFF;
            }
            if (buffer.hasRemaining()) {
                throw new InvalidAdvertisementException(buffer.remaining() + " trailing bytes after advertisement");
            }
            return new BleAdvertisement(version, socketVersion, fast, serviceIdHash, data, deviceToken, psm);
        } catch (BufferUnderflowException e) {
            throw new InvalidAdvertisementException("advertisement truncated at " + bytes.length + " bytes");
        }
    }

    @Override
    public byte[] getBytes() {
        int length = HEADER_BYTE_LENGTH + data.length + DEVICE_TOKEN_LENGTH;
        if (fastAdvertisement) {
            length += FAST_DATA_SIZE_LENGTH;
        } else {
            length += SERVICE_ID_HASH_LENGTH + DATA_SIZE_LENGTH;
            if (psm != DEFAULT_PSM) {
                length += PSM_LENGTH;
            }
        }
        final ByteBuffer buffer = ByteBuffer.allocate(length);
        buffer.put((byte) ((version.getVal() << 5)
                | (socketVersion.getVal() << 2)
                | (fastAdvertisement ? FAST_FLAG : 0)));
        if (fastAdvertisement) {
            buffer.put((byte) data.length);
        } else {
            buffer.put(serviceIdHash);
            buffer.putInt(data.length);
        }
        buffer.put(data);
        buffer.put(deviceToken);
        if (!fastAdvertisement && psm != DEFAULT_PSM) {
            buffer.putShort((short) psm);
        }
        return buffer.array();
    }

    /**
     * Checks whether this advertisement was produced for a service id.
     * Always false for fast advertisements, which carry no hash.
     *
     * @param serviceId candidate service id
     * @return true if the hashes match
     */
    public boolean matchesServiceId(String serviceId) {
        return !fastAdvertisement
                && Arrays.equals(serviceIdHash, BleUtils.generateServiceIdHash(serviceId, version));
    }

    public Version getVersion() {
        return version;
    }

    public SocketVersion getSocketVersion() {
        return socketVersion;
    }

    public boolean isFastAdvertisement() {
        return fastAdvertisement;
    }

    public byte[] getServiceIdHash() {
        return serviceIdHash.clone();
    }

    public byte[] getData() {
        return data.clone();
    }

    public byte[] getDeviceToken() {
        return deviceToken.clone();
    }

    public int getPsm() {
        return psm;
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    /**
     * builder for ble advertisement
     */
    public static class Builder {
        private Version version = Version.V2;
        private SocketVersion socketVersion = SocketVersion.V2;
        private boolean fastAdvertisement;
        private String serviceId;
        private byte[] data;
        private byte[] deviceToken;
        private int psm = DEFAULT_PSM;

        public Builder setVersion(Version version) {
            this.version = version;
            return this;
        }

        public Builder setSocketVersion(SocketVersion socketVersion) {
            this.socketVersion = socketVersion;
            return this;
        }

        /**
         * Fast advertisements omit the service id hash; the service is identified
         * by the uuid the advertisement is published under.
         *
         * @param fastAdvertisement true for the fast path
         * @return builder
         */
        public Builder setFastAdvertisement(boolean fastAdvertisement) {
            this.fastAdvertisement = fastAdvertisement;
            return this;
        }

        public Builder setServiceId(String serviceId) {
            this.serviceId = serviceId;
            return this;
        }

        public Builder setData(byte[] data) {
            this.data = data;
            return this;
        }

        /**
         * Overrides the device token. A fresh random token is generated when unset.
         *
         * @param deviceToken token of {@link #DEVICE_TOKEN_LENGTH} bytes
         * @return builder
         */
        public Builder setDeviceToken(byte[] deviceToken) {
            this.deviceToken = deviceToken;
            return this;
        }

        public Builder setPsm(int psm) {
            this.psm = psm;
            return this;
        }

        /**
         * Build ble advertisement.
         *
         * @return the advertisement, or null if the data is empty or too long,
         * the service id is missing on the regular path, or a field is out of range
         */
        public BleAdvertisement build() {
            if (version == null || socketVersion == null) {
                return null;
            }
            if (data == null || data.length == 0) {
                return null;
            }
            if (data.length > (fastAdvertisement ? MAX_FAST_DATA_LENGTH : MAX_DATA_LENGTH)) {
                return null;
            }
            if (!fastAdvertisement && serviceId == null) {
                return null;
            }
            if (psm < 0 || psm > MAX_PSM || (fastAdvertisement && psm != DEFAULT_PSM)) {
                return null;
            }
            final byte[] token = deviceToken == null ? BleUtils.generateDeviceToken() : deviceToken.clone();
            if (token.length != DEVICE_TOKEN_LENGTH) {
                return null;
            }
            final byte[] hash = fastAdvertisement
                    ? new byte[0]
                    : BleUtils.generateServiceIdHash(serviceId, version);
            return new BleAdvertisement(version, socketVersion, fastAdvertisement, hash, data.clone(), token, psm);
        }
    }
}
