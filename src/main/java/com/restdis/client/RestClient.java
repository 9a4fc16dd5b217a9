package com.restdis.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.restdis.codec.ReplyDecoder;
import com.restdis.constants.RestProtocol;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Redis REST API istemcisidir. Ayarları oluşturulduktan sonra değişmez ve
 * {@link RestTransport} eşzamanlı kullanıma uygun olduğu sürece thread'ler
 * arasında paylaşılabilir. Komutlar {@link #newRequest()} ile açılan
 * {@link RestRequest} üzerinden kuyruğa alınır ve çalıştırılır.
 */
public final class RestClient
{
    private final URI baseUrl;
    private final URI pipelineUrl;
    private final String apiToken;
    private final RestTransport transport;
    private final ObjectMapper mapper;
    private final ReplyDecoder decoder;
    private final Map<String, String> headers;

    private RestClient(Builder builder)
    {
        this.baseUrl = Objects.requireNonNull(builder.baseUrl, "baseUrl");
        this.pipelineUrl = pipelineUrl(baseUrl);
        this.apiToken = builder.apiToken == null ? "" : builder.apiToken;
        this.transport = Objects.requireNonNull(builder.transport, "transport");
        this.mapper = builder.mapper == null ? new ObjectMapper() : builder.mapper;
        this.decoder = new ReplyDecoder(mapper);
        this.headers = Map.copyOf(builder.headers);
    }

    public static Builder builder(String baseUrl)
    {
        return new Builder(URI.create(baseUrl));
    }

    public static Builder builder(URI baseUrl)
    {
        return new Builder(baseUrl);
    }

    public RestRequest newRequest()
    {
        return new RestRequest(this, apiToken);
    }

    /**
     * İstemcinin token'ı yerine verilen token'la çalışan bir istek açar;
     * {@code ACL RESTTOKEN} ile alınmış token'lar aynı istemci ayarlarıyla bu yolla
     * kullanılır.
     */
    public RestRequest newRequestWithToken(String token)
    {
        return new RestRequest(this, token == null ? "" : token);
    }

    URI baseUrl()
    {
        return baseUrl;
    }

    URI pipelineUrl()
    {
        return pipelineUrl;
    }

    RestTransport transport()
    {
        return transport;
    }

    ObjectMapper mapper()
    {
        return mapper;
    }

    ReplyDecoder decoder()
    {
        return decoder;
    }

    Map<String, String> headers()
    {
        return headers;
    }

    static URI pipelineUrl(URI base)
    {
        String path = base.getPath() == null ? "" : base.getPath();
        while (path.endsWith("/")) {
            path = path.substring(0, path.length() - 1);
        }
        try {
            return new URI(base.getScheme(), base.getAuthority(), path + RestProtocol.PIPELINE_PATH, base.getQuery(), null);
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Invalid base URL: " + base, e);
        }
    }

    public static final class Builder
    {
        private final URI baseUrl;
        private String apiToken;
        private RestTransport transport;
        private ObjectMapper mapper;
        private final Map<String, String> headers = new LinkedHashMap<>();

        private Builder(URI baseUrl)
        {
            this.baseUrl = Objects.requireNonNull(baseUrl, "baseUrl");
        }

        public Builder apiToken(String apiToken)
        {
            this.apiToken = apiToken;
            return this;
        }

        public Builder transport(RestTransport transport)
        {
            this.transport = transport;
            return this;
        }

        public Builder mapper(ObjectMapper mapper)
        {
            this.mapper = mapper;
            return this;
        }

        /**
         * Her isteğe eklenecek başlık. {@code Authorization} burada verilirse
         * token yerine olduğu gibi kullanılır.
         */
        public Builder header(String name, String value)
        {
            headers.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(value, "value"));
            return this;
        }

        public RestClient build()
        {
            return new RestClient(this);
        }
    }
}
