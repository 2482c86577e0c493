package org.stocktake.remote;

/**
 * 照片存储
 * 需要网络连接，失败时抛出 {@link org.stocktake.exception.RemoteServiceException}
 */
public interface BlobStore {

    /**
     * @param localUri 本地照片路径
     * @return 远端访问地址
     */
    String uploadPhoto(String localUri);
}
