package com.yanduoduo.auth.config;

import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.interfaces.RSAPrivateKey;
import java.security.interfaces.RSAPublicKey;
import java.security.spec.PKCS8EncodedKeySpec;
import java.security.spec.X509EncodedKeySpec;
import java.util.Base64;

/**
 * PEM 密钥读取工具，供访问令牌的 RS256 签名与校验使用。
 */
public final class PemUtils {

    private static final String PRIVATE_LABEL = "PRIVATE KEY";
    private static final String PUBLIC_LABEL = "PUBLIC KEY";

    private PemUtils() {
    }

    /**
     * 读取 PKCS#8 格式的 RSA 私钥。
     *
     * @param resource 私钥 PEM 资源。
     * @return RSA 私钥。
     * @throws IllegalStateException 资源缺失、读取或解析失败时抛出。
     */
    public static RSAPrivateKey readPrivateKey(Resource resource) {
        try {
            byte[] der = decode(resource, PRIVATE_LABEL);
            return (RSAPrivateKey) KeyFactory.getInstance("RSA").generatePrivate(new PKCS8EncodedKeySpec(der));
        } catch (IOException | GeneralSecurityException | IllegalArgumentException ex) {
            throw new IllegalStateException("Failed to read RSA private key from " + resource, ex);
        }
    }

    /**
     * 读取 X.509 格式的 RSA 公钥。
     *
     * @param resource 公钥 PEM 资源。
     * @return RSA 公钥。
     * @throws IllegalStateException 资源缺失、读取或解析失败时抛出。
     */
    public static RSAPublicKey readPublicKey(Resource resource) {
        try {
            byte[] der = decode(resource, PUBLIC_LABEL);
            return (RSAPublicKey) KeyFactory.getInstance("RSA").generatePublic(new X509EncodedKeySpec(der));
        } catch (IOException | GeneralSecurityException | IllegalArgumentException ex) {
            throw new IllegalStateException("Failed to read RSA public key from " + resource, ex);
        }
    }

    private static byte[] decode(Resource resource, String label) throws IOException {
        if (resource == null) {
            throw new IOException("PEM resource for " + label + " is not configured");
        }
        String pem;
        try (InputStream is = resource.getInputStream()) {
            pem = new String(is.readAllBytes(), StandardCharsets.UTF_8);
        }
        String body = pem.replace("-----BEGIN " + label + "-----", "")
                .replace("-----END " + label + "-----", "")
                .replaceAll("\\s", "");
        return Base64.getDecoder().decode(body);
    }
}
