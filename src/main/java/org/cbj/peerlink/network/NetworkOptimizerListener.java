package org.cbj.peerlink.network;

import org.cbj.peerlink.network.dto.BandwidthMeasurement;
import org.cbj.peerlink.network.dto.NetworkConditions;
import org.cbj.peerlink.network.dto.QualitySettings;

public interface NetworkOptimizerListener {

    default void onBandwidthMeasured(BandwidthMeasurement measurement) {
    }

    default void onConditionsMeasured(NetworkConditions conditions) {
    }

    /** Raised by the monitor tick when conditions moved past the adaptation threshold. */
    default void onConditionsChanged(NetworkConditions conditions) {
    }

    default void onQualityAdapted(NetworkConditions conditions, QualitySettings settings) {
    }

    default void onCongestionHandled(QualitySettings settings) {
    }

    default void onQualityUpdated(QualitySettings settings) {
    }

    default void onQualityReset(QualitySettings settings) {
    }
}
