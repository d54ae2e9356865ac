package com.ckpt.store;

import com.ckpt.shared.CkptConfig;

import com.google.inject.Inject;

import io.etcd.jetcd.ByteSequence;
import io.etcd.jetcd.Client;
import io.etcd.jetcd.ClientBuilder;
import io.etcd.jetcd.KV;
import io.etcd.jetcd.KeyValue;
import io.etcd.jetcd.kv.GetResponse;
import io.etcd.jetcd.options.GetOption;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

public class EtcdSnapshotStore implements SnapshotStore {

    private static final Logger log = LoggerFactory.getLogger(EtcdSnapshotStore.class);
    private static final long TIMEOUT_SECONDS = 5;

    private final CkptConfig config;
    private final String namespace;
    private Client client;
    private KV kvClient;

    @Inject
    public EtcdSnapshotStore(CkptConfig config) {
        this.config = config;
        this.namespace = "/" + config.getBucketName() + "/";
    }

    private ByteSequence bs(String s) {
        return ByteSequence.from(s, StandardCharsets.UTF_8);
    }

    private String str(ByteSequence bs) {
        return bs.toString(StandardCharsets.UTF_8);
    }

    private String namespaced(String key) {
        return namespace + key;
    }

    @Override
    public void initialize() {
        String endpoint = "http://" + config.getStoreHost() + ":" + config.getStorePort();
        ClientBuilder builder = Client.builder().endpoints(endpoint);
        if (config.getStoreUser() != null && !config.getStoreUser().isEmpty()) {
            builder.user(bs(config.getStoreUser()))
                    .password(bs(config.getStorePassword()));
        }
        client = builder.build();
        kvClient = client.getKVClient();
        log.info("Connected to etcd snapshot store at {} (bucket={})", endpoint, config.getBucketName());
    }

    @Override
    public void close() {
        if (client != null) {
            client.close();
        }
    }

    @Override
    public void put(String key, byte[] bytes) {
        try {
            kvClient.put(bs(namespaced(key)), ByteSequence.from(bytes))
                    .get(TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SnapshotStoreException("Interrupted while writing " + key, e);
        } catch (ExecutionException | TimeoutException e) {
            throw new SnapshotStoreException("Failed to write " + key, e);
        }
    }

    @Override
    public byte[] get(String key) {
        try {
            GetResponse resp = kvClient.get(bs(namespaced(key)))
                    .get(TIMEOUT_SECONDS, TimeUnit.SECONDS);
            if (resp.getKvs().isEmpty()) {
                throw new SnapshotNotFoundException(key);
            }
            return resp.getKvs().get(0).getValue().getBytes();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SnapshotStoreException("Interrupted while reading " + key, e);
        } catch (ExecutionException | TimeoutException e) {
            throw new SnapshotStoreException("Failed to read " + key, e);
        }
    }

    @Override
    public List<String> list(String prefix) {
        try {
            GetOption option = GetOption.newBuilder()
                    .isPrefix(true)
                    .withKeysOnly(true)
                    .build();
            GetResponse resp = kvClient.get(bs(namespaced(prefix)), option)
                    .get(TIMEOUT_SECONDS, TimeUnit.SECONDS);
            List<String> keys = new ArrayList<>();
            for (KeyValue kv : resp.getKvs()) {
                keys.add(str(kv.getKey()).substring(namespace.length()));
            }
            Collections.sort(keys);
            return keys;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SnapshotStoreException("Interrupted while listing " + prefix, e);
        } catch (ExecutionException | TimeoutException e) {
            throw new SnapshotStoreException("Failed to list " + prefix, e);
        }
    }

    @Override
    public void delete(String key) {
        try {
            kvClient.delete(bs(namespaced(key)))
                    .get(TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SnapshotStoreException("Interrupted while deleting " + key, e);
        } catch (ExecutionException | TimeoutException e) {
            throw new SnapshotStoreException("Failed to delete " + key, e);
        }
    }
}
