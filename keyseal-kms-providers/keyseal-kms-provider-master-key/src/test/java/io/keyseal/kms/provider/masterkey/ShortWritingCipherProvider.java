/*
 * Copyright Keyseal Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.keyseal.kms.provider.masterkey;

import java.security.AlgorithmParameters;
import java.security.GeneralSecurityException;
import java.security.Key;
import java.security.Provider;
import java.security.SecureRandom;
import java.security.spec.AlgorithmParameterSpec;

import javax.crypto.Cipher;
import javax.crypto.CipherSpi;

/**
 * A JCA provider whose {@code AES/GCM/NoPadding} cipher reports writing only {@link #WRITTEN} bytes on
 * {@code doFinal}, whatever the input. Not registered with {@link java.security.Security}.
 */
public final class ShortWritingCipherProvider extends Provider {

    static final int WRITTEN = 8;

    public ShortWritingCipherProvider() {
        super("KeysealShortWriting", "1.0", "AES/GCM cipher that writes too few bytes");
        put("Cipher." + CipherSuite.AES_256_GCM.transformation(), Spi.class.getName());
    }

    /**
     * A sealer using this provider for every cipher it creates.
     */
    static DataKeySealer sealer() {
        var provider = new ShortWritingCipherProvider();
        return new DataKeySealer(CipherSuite.AES_256_GCM, new SecureRandom()) {
            @Override
            Cipher newCipher(CipherSuite suite) throws GeneralSecurityException {
                return Cipher.getInstance(suite.transformation(), provider);
            }
        };
    }

    public static final class Spi extends CipherSpi {

        public Spi() {
        }

        @Override
        protected void engineSetMode(String mode) {
        }

        @Override
        protected void engineSetPadding(String padding) {
        }

        @Override
        protected int engineGetBlockSize() {
            return 16;
        }

        @Override
        protected int engineGetOutputSize(int inputLen) {
            return inputLen + CipherSuite.TAG_LENGTH;
        }

        @Override
        protected byte[] engineGetIV() {
            return null;
        }

        @Override
        protected AlgorithmParameters engineGetParameters() {
            return null;
        }

        @Override
        protected void engineInit(int opmode, Key key, SecureRandom random) {
        }

        @Override
        protected void engineInit(int opmode, Key key, AlgorithmParameterSpec params, SecureRandom random) {
        }

        @Override
        protected void engineInit(int opmode, Key key, AlgorithmParameters params, SecureRandom random) {
        }

        @Override
        protected void engineUpdateAAD(byte[] src, int offset, int len) {
        }

        @Override
        protected byte[] engineUpdate(byte[] input, int inputOffset, int inputLen) {
            return new byte[0];
        }

        @Override
        protected int engineUpdate(byte[] input, int inputOffset, int inputLen, byte[] output, int outputOffset) {
            return 0;
        }

        @Override
        protected byte[] engineDoFinal(byte[] input, int inputOffset, int inputLen) {
            return new byte[WRITTEN];
        }

        @Override
        protected int engineDoFinal(byte[] input, int inputOffset, int inputLen, byte[] output, int outputOffset) {
            System.arraycopy(input, inputOffset, output, outputOffset, WRITTEN);
            return WRITTEN;
        }
    }
}
