/**
 * Runtime facade package.
 *
 * <p>{@link io.pricedock.runtime.PriceDockRuntime} is the single entry point the CLI uses:
 * single-file imports, the locked daily import, supervised child runs, the stale-run reaper
 * and the read-only views over runs, quarantine and schema migrations.
 */
package io.pricedock.runtime;
