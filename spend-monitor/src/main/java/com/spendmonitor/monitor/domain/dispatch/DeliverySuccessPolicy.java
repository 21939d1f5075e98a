package com.spendmonitor.monitor.domain.dispatch;

import java.util.List;

/**
 * How per-channel outcomes fold into the overall success of a dispatch.
 */
public enum DeliverySuccessPolicy {

    BROADCAST_SUCCEEDED {
        @Override
        public boolean evaluate(DeliveryResult broadcast, List<DeliveryResult> pushes) {
            return broadcast.success();
        }
    },

    ANY_CHANNEL_SUCCEEDED {
        @Override
        public boolean evaluate(DeliveryResult broadcast, List<DeliveryResult> pushes) {
            return broadcast.success() || pushes.stream().anyMatch(DeliveryResult::success);
        }
    },

    ALL_CHANNELS_SUCCEEDED {
        @Override
        public boolean evaluate(DeliveryResult broadcast, List<DeliveryResult> pushes) {
            return broadcast.success() && pushes.stream().allMatch(DeliveryResult::success);
        }
    };

    public abstract boolean evaluate(DeliveryResult broadcast, List<DeliveryResult> pushes);
}
