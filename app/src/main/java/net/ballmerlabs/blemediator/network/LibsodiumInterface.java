package net.ballmerlabs.blemediator.network;

import com.goterl.lazysodium.LazySodiumJava;
import com.goterl.lazysodium.Sodium;
import com.goterl.lazysodium.SodiumJava;
import com.goterl.lazysodium.interfaces.GenericHash;
import com.goterl.lazysodium.interfaces.Hash;

/**
 * Singleton interface to libsodium/lazysodium over JNA
 */
public class LibsodiumInterface {
    private static volatile LazySodiumJava mSodiumInstance = null;

    private LibsodiumInterface() {}

    private static void checkSodium() {
        if (mSodiumInstance == null) {
            synchronized (LibsodiumInterface.class) {
                if (mSodiumInstance == null) {
                    mSodiumInstance = new LazySodiumJava(new SodiumJava());
                }
            }
        }
    }

    public static Sodium getSodium() {
        checkSodium();
        return mSodiumInstance.getSodium();
    }

    /**
     * SHA-256 of the input.
     *
     * @param in bytes to hash
     * @return 32 byte digest
     */
    public static byte[] sha256(byte[] in) {
        final byte[] out = new byte[Hash.SHA256_BYTES];
        if (getSodium().crypto_hash_sha256(out, in, in.length) != 0) {
            throw new IllegalStateException("crypto_hash_sha256 failed");
        }
        return out;
    }

    /**
     * Unkeyed BLAKE2b of the input with the minimum output length.
     *
     * @param in bytes to hash
     * @return 16 byte digest
     */
    public static byte[] genericHash(byte[] in) {
        final byte[] out = new byte[GenericHash.BYTES_MIN];
        if (getSodium().crypto_generichash(out, out.length, in, in.length, null, 0) != 0) {
            throw new IllegalStateException("crypto_generichash failed");
        }
        return out;
    }

    public static byte[] randomBytes(int length) {
        final byte[] out = new byte[length];
        getSodium().randombytes_buf(out, out.length);
        return out;
    }
}
