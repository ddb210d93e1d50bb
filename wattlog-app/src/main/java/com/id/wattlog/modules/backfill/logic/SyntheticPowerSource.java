package com.id.wattlog.modules.backfill.logic;

/**
 * Supplies plausible readings for hours without a live feed.
 */
public interface SyntheticPowerSource {

    /**
     * @return a wattage for one synthetic hour
     */
    int nextWatts();

    /**
     * @return true if the whole calendar day about to be generated should be left empty
     */
    boolean skipDay();
}
