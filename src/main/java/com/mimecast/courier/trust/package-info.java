/**
 * Everything related to digital trust, certificates, and their validation.
 *
 * <p>The {@link com.mimecast.courier.trust.ClientCertificate} loads the key store presented by ad hoc clients.
 * <br>The {@link com.mimecast.courier.trust.PermissiveTrustManager} is the default certificate validator paired with it.
 * <br>The {@link com.mimecast.courier.trust.TrustManager} can be plugged in instead to validate against a trust store.
 *
 * @see com.mimecast.courier.main.Factories
 */
package com.mimecast.courier.trust;
