package com.yanduoduo.storage;

import java.io.IOException;
import java.util.Optional;

/**
 * 头像文件存储。
 */
public interface AvatarStore {

    /**
     * 保存头像内容并返回生成的文件名。
     *
     * @param content      图片字节。
     * @param userId       用户 ID，参与文件名生成。
     * @param originalName 客户端提供的原始文件名，仅用于推断扩展名，可为空。
     * @return 生成的文件名（不含目录）。
     * @throws IOException 写入失败时抛出。
     */
    String save(byte[] content, long userId, String originalName) throws IOException;

    /**
     * 文件名对应的公开访问路径，如 `/public/uploads/avatar/xxx.png`。
     */
    String urlFor(String fileName);

    /**
     * 由 {@link #urlFor} 生成的路径反推文件名；不是本存储的路径时返回空。
     */
    Optional<String> fileNameOf(String url);

    /**
     * 删除头像文件，文件不存在时忽略。删除失败只记录日志。
     */
    void delete(String fileName);
}
