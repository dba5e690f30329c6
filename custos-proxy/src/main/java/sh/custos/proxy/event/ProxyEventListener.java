// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.custos.proxy.event;

/**
 * Receives events of committed proxy operations, in emission order.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface ProxyEventListener {

    void onEvent(ProxyEvent event);
}
