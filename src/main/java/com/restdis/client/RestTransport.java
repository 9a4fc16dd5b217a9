package com.restdis.client;

/**
 * REST çağrısını gerçekleştiren HTTP katmanıdır. Zaman aşımı, yeniden deneme ve
 * bağlantı yönetimi implementasyona aittir. Ağ seviyesindeki hatalar
 * {@link RestClientException.Reason#TRANSPORT} ile bildirilmelidir.
 */
@FunctionalInterface
public interface RestTransport
{
    TransportResponse post(TransportRequest request);
}
