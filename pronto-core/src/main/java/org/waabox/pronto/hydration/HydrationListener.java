package org.waabox.pronto.hydration;

/**
 * Callback invoked when a namespace is upgraded to its full dataset.
 *
 * <p>Consumers typically re-render with the full data. Listeners run on a
 * loader thread and should return quickly.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@FunctionalInterface
public interface HydrationListener {

  /**
   * Called once per hydration of the namespace the listener subscribed to.
   *
   * @param event the hydration event, never null
   */
  void onHydrated(HydrationEvent event);
}
