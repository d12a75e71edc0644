/*
 * Copyright Keyseal Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.keyseal.kms.provider.masterkey;

import io.keyseal.kms.service.TestKmsFacadeFactory;

public class MasterKeyKmsFacadeFactory implements TestKmsFacadeFactory<MasterKeyKmsService.Config> {
    @Override
    public MasterKeyKmsFacade build() {
        return new MasterKeyKmsFacade();
    }
}
