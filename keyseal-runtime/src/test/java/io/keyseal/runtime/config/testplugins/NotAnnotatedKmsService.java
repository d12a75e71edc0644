/*
 * Copyright Keyseal Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.keyseal.runtime.config.testplugins;

import io.keyseal.kms.service.Kms;
import io.keyseal.kms.service.KmsService;

public class NotAnnotatedKmsService implements KmsService<Void> {

    @Override
    public void initialize(Void config) {
        // no config needed
    }

    @Override
    public Kms buildKms() {
        throw new UnsupportedOperationException();
    }
}
