/**
 * See {@link party.iroiro.r2oracle.codecs.Codec}
 *
 * <p>
 * To customize conversions, implement {@link party.iroiro.r2oracle.codecs.Codec}, probably by
 * extending {@link party.iroiro.r2oracle.codecs.OracleCodec}, and pass its class name through
 * {@link party.iroiro.r2oracle.OracleConnectOptions#CODEC}.
 * </p>
 */
@NonNullApi
package party.iroiro.r2oracle.codecs;

import reactor.util.annotation.NonNullApi;
