package org.stocktake.config;

import org.stocktake.remote.BlobStore;
import org.stocktake.remote.InventoryService;
import org.stocktake.remote.RestBlobStore;
import org.stocktake.remote.RestInventoryService;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * 远端服务客户端配置
 */
@Configuration
public class RemoteServiceConfig {

    @Bean
    public InventoryService inventoryService(RestClient.Builder restClientBuilder, StockTakeProperties properties) {
        return new RestInventoryService(buildClient(restClientBuilder, properties.getInventory()));
    }

    @Bean
    public BlobStore blobStore(RestClient.Builder restClientBuilder, StockTakeProperties properties) {
        return new RestBlobStore(buildClient(restClientBuilder, properties.getBlobStore()));
    }

    private static RestClient buildClient(RestClient.Builder builder, StockTakeProperties.Remote remote) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(remote.getConnectTimeout());
        requestFactory.setReadTimeout(remote.getReadTimeout());
        return builder.clone()
                .baseUrl(remote.getBaseUrl())
                .requestFactory(requestFactory)
                .build();
    }
}
