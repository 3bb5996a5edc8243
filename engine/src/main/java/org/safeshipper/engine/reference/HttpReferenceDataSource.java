package org.safeshipper.engine.reference;

import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.OkHttpClient;
import org.safeshipper.engine.api.dto.ReferenceDataDto;
import retrofit2.Call;
import retrofit2.Response;
import retrofit2.Retrofit;
import retrofit2.converter.jackson.JacksonConverterFactory;
import retrofit2.http.GET;

import java.io.IOException;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

/**
 * Retrofit-based reference data source fetching GET v1/compliance/reference-data.
 */
public final class HttpReferenceDataSource implements ReferenceDataSource {

    private static final Logger LOG = Logger.getLogger(HttpReferenceDataSource.class.getName());

    private static final String DESCRIPTION = "GET /v1/compliance/reference-data";

    private final String baseUrl;
    private final ReferenceDataApi api;

    public HttpReferenceDataSource(String baseUrl) {
        Objects.requireNonNull(baseUrl, "baseUrl must not be null");

        this.baseUrl = baseUrl.endsWith("/") ? baseUrl : baseUrl + "/";

        OkHttpClient client = new OkHttpClient.Builder()
                .connectTimeout(10, TimeUnit.SECONDS)
                .readTimeout(30, TimeUnit.SECONDS)
                .writeTimeout(10, TimeUnit.SECONDS)
                .build();

        Retrofit retrofit = new Retrofit.Builder()
                .baseUrl(this.baseUrl)
                .addConverterFactory(JacksonConverterFactory.create(new ObjectMapper()))
                .client(client)
                .build();

        this.api = retrofit.create(ReferenceDataApi.class);
    }

    @Override
    public ReferenceDataDto load() {
        return execute(api.getReferenceData(), DESCRIPTION);
    }

    @Override
    public String describe() {
        return baseUrl + "v1/compliance/reference-data";
    }

    /**
     * Execute a Retrofit call, turning every failure into a ReferenceDataException.
     */
    private <T> T execute(Call<T> call, String description) {
        Response<T> response;
        try {
            response = call.execute();
        } catch (IOException e) {
            throw new ReferenceDataException("[API] " + description + " error", e);
        }
        if (!response.isSuccessful()) {
            LOG.warning(() -> String.format("[API] %s failed: %d %s",
                    description, response.code(), response.message()));
            throw new ReferenceDataException(String.format("[API] %s failed: %d %s",
                    description, response.code(), response.message()));
        }
        T body = response.body();
        if (body == null) {
            throw new ReferenceDataException("[API] " + description + " returned an empty body");
        }
        return body;
    }

    /**
     * Retrofit service interface for the compliance reference endpoint.
     */
    interface ReferenceDataApi {
        @GET("v1/compliance/reference-data")
        Call<ReferenceDataDto> getReferenceData();
    }
}
