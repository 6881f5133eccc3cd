package com.platform.planner.plan;

import com.platform.planner.remote.RemoteService;
import com.platform.planner.spec.AutomationSetting;
import com.platform.planner.spec.PlanSpec;
import com.platform.planner.spec.PlanType;

import java.util.List;

/**
 * Balance plans: on-prem optimization with every provision, suspend and
 * resize action disabled, used as the baseline for headroom reporting.
 */
public final class BalancePlans {
    
    static final List<AutomationSetting> DISABLED_ACTIONS = List.of(
        AutomationSetting.PROVISION_DS,
        AutomationSetting.SUSPEND_DS,
        AutomationSetting.PROVISION_PM,
        AutomationSetting.SUSPEND_PM,
        AutomationSetting.RESIZE
    );
    
    private BalancePlans() {
    }
    
    /**
     * Builds a balance spec.
     *
     * @param scope clusters to balance; when null every cluster of the base market
     */
    public static PlanSpec balanceSpec(RemoteService remote, String baseMarket, List<String> scope) {
        List<String> clusters = scope != null ? scope : remote.findClusterIds(baseMarket);
        
        PlanSpec spec = new PlanSpec(null, PlanType.OPTIMIZE_ONPREM, clusters, null);
        for (AutomationSetting setting : DISABLED_ACTIONS) {
            spec.changeAutomationSetting(setting, false);
        }
        return spec;
    }
    
    public static Plan balance(RemoteService remote, PlanRunOptions options, List<String> scope) {
        PlanRunOptions effective = options != null ? options : PlanRunOptions.defaults();
        return Plan.builder()
            .remote(remote)
            .spec(balanceSpec(remote, effective.getBaseMarket(), scope))
            .options(effective)
            .build();
    }
}
