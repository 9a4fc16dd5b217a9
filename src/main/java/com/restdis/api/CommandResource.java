package com.restdis.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.restdis.constants.RestProtocol;
import com.restdis.server.DispatchResult;
import com.restdis.server.RestCall;
import com.restdis.server.RestDispatcher;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.PATCH;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.PUT;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.UriInfo;
import org.jboss.logging.Logger;

import java.io.InputStream;
import java.util.Objects;

/**
 * Redis komutlarını REST üzerinden çalıştıran kaynaktır. Komut kök yola JSON dizisi
 * olarak, {@code /pipeline} yoluna dizilerin dizisi olarak ya da doğrudan yol
 * parçaları, gövde ve sorgu dizesiyle ({@code /set/a?EX=10}) gönderilebilir.
 * Tüm kararlar {@link RestDispatcher} tarafından verilir; bu katman yalnızca
 * HTTP isteğini ona aktarır ve dönen zarfı yazar.
 * <p>
 * PUT, DELETE ve PATCH de burada karşılanır, böylece yetkisiz istekler 405 yerine
 * önce 401 alır.
 */
@Path("/")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
public class CommandResource
{
    private static final Logger LOG = Logger.getLogger(CommandResource.class);
    private static final String JSON_UTF8 = MediaType.APPLICATION_JSON + "; charset=utf-8";

    private final RestDispatcher dispatcher;
    private final ObjectMapper mapper;

    @Inject
    public CommandResource(RestDispatcher dispatcher, ObjectMapper mapper)
    {
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    @GET
    public Response getRoot(@Context UriInfo uri, @Context HttpHeaders headers, InputStream body)
    {
        return handle(RestProtocol.METHOD_GET, uri, headers, body);
    }

    @POST
    public Response postRoot(@Context UriInfo uri, @Context HttpHeaders headers, InputStream body)
    {
        return handle(RestProtocol.METHOD_POST, uri, headers, body);
    }

    @PUT
    public Response putRoot(@Context UriInfo uri, @Context HttpHeaders headers, InputStream body)
    {
        return handle("PUT", uri, headers, body);
    }

    @DELETE
    public Response deleteRoot(@Context UriInfo uri, @Context HttpHeaders headers, InputStream body)
    {
        return handle("DELETE", uri, headers, body);
    }

    @PATCH
    public Response patchRoot(@Context UriInfo uri, @Context HttpHeaders headers, InputStream body)
    {
        return handle("PATCH", uri, headers, body);
    }

    @GET
    @Path("{command: .+}")
    public Response get(@Context UriInfo uri, @Context HttpHeaders headers, InputStream body)
    {
        return handle(RestProtocol.METHOD_GET, uri, headers, body);
    }

    @POST
    @Path("{command: .+}")
    public Response post(@Context UriInfo uri, @Context HttpHeaders headers, InputStream body)
    {
        return handle(RestProtocol.METHOD_POST, uri, headers, body);
    }

    @PUT
    @Path("{command: .+}")
    public Response put(@Context UriInfo uri, @Context HttpHeaders headers, InputStream body)
    {
        return handle("PUT", uri, headers, body);
    }

    @DELETE
    @Path("{command: .+}")
    public Response delete(@Context UriInfo uri, @Context HttpHeaders headers, InputStream body)
    {
        return handle("DELETE", uri, headers, body);
    }

    @PATCH
    @Path("{command: .+}")
    public Response patch(@Context UriInfo uri, @Context HttpHeaders headers, InputStream body)
    {
        return handle("PATCH", uri, headers, body);
    }

    private Response handle(String method, UriInfo uri, HttpHeaders headers, InputStream body)
    {
        RestCall call = new RestCall(
                method,
                uri.getPath(),
                uri.getRequestUri().getRawQuery(),
                headers.getHeaderString(RestProtocol.AUTHORIZATION_HEADER),
                () -> body == null ? new byte[0] : body.readAllBytes());

        DispatchResult result = dispatcher.dispatch(call);
        Response.ResponseBuilder builder = Response.status(result.status()).type(JSON_UTF8);
        if (!result.hasBody()) {
            return builder.build();
        }
        try {
            return builder.entity(mapper.writeValueAsBytes(result.body())).build();
        } catch (JsonProcessingException e) {
            LOG.errorf(e, "Failed to serialize reply for %s", uri.getPath());
            return Response.serverError().build();
        }
    }
}
