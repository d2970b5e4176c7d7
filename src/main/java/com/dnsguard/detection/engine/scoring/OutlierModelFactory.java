package com.dnsguard.detection.engine.scoring;

@FunctionalInterface
public interface OutlierModelFactory {

    /** A fresh, unfitted model. */
    OutlierModel create();
}
