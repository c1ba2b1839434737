// file: bench/src/main/java/io/stow/bench/CodecBench.java
package io.stow.bench;

import io.stow.core.Codec;
import io.stow.core.PooledCodec;
import io.stow.core.PrimedCodec;
import io.stow.core.format.JsonCodec;
import io.stow.core.format.KryoCodec;
import io.stow.storage.Store;
import io.stow.storage.engine.MvStoreEngine;

import java.nio.charset.StandardCharsets;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Compares codecs on an in-memory engine: put/get throughput and stored bytes per record.
 *
 * Usage:
 *   java -cp stow-bench.jar io.stow.bench.CodecBench \
 *     --records 50000 \
 *     --reads 200000 \
 *     --threads 4 \
 *     --codecs kryo,primed,pooled,json
 *
 * Output:
 *   - One progress line per codec to stderr.
 *   - CSV to stdout:
 *       codec,put_ops_s,get_ops_s,bytes_per_record
 */
public final class CodecBench {

    /** Value type written by every run. */
    public static final class Reading {
        public String sensor;
        public long timestamp;
        public double value;
        public List<String> tags;

        public Reading() {
        }

        Reading(String sensor, long timestamp, double value, List<String> tags) {
            this.sensor = sensor;
            this.timestamp = timestamp;
            this.value = value;
            this.tags = tags;
        }
    }

    private static final class Result {
        final String codec;
        final double putOpsPerSec;
        final double getOpsPerSec;
        final double bytesPerRecord;

        Result(String codec, double putOpsPerSec, double getOpsPerSec, double bytesPerRecord) {
            this.codec = codec;
            this.putOpsPerSec = putOpsPerSec;
            this.getOpsPerSec = getOpsPerSec;
            this.bytesPerRecord = bytesPerRecord;
        }
    }

    public static void main(String[] args) throws Exception {
        Map<String, String> cfg = parseArgs(args);

        int records = Integer.parseInt(cfg.getOrDefault("records", "50000"));
        int reads = Integer.parseInt(cfg.getOrDefault("reads", "200000"));
        int threads = Integer.parseInt(cfg.getOrDefault("threads", "4"));
        List<String> codecs = Arrays.asList(cfg.getOrDefault("codecs", "kryo,primed,pooled,json").split(","));

        List<Result> results = new ArrayList<>();
        for (String name : codecs) {
            Result r = runOne(name.trim(), codecFor(name.trim()), records, reads, threads);
            System.err.printf("%-8s put=%.0f ops/s, get=%.0f ops/s, %.1f bytes/record%n",
                    r.codec, r.putOpsPerSec, r.getOpsPerSec, r.bytesPerRecord);
            results.add(r);
        }

        System.out.println("codec,put_ops_s,get_ops_s,bytes_per_record");
        for (Result r : results) {
            System.out.printf("%s,%.2f,%.2f,%.2f%n", r.codec, r.putOpsPerSec, r.getOpsPerSec, r.bytesPerRecord);
        }
    }

    private static Map<String, String> parseArgs(String[] args) {
        Map<String, String> out = new HashMap<>();
        for (int i = 0; i < args.length; i++) {
            String a = args[i];
            if (a.startsWith("--")) {
                String key = a.substring(2);
                if (i + 1 >= args.length) {
                    throw new IllegalArgumentException("missing value for " + a);
                }
                out.put(key, args[++i]);
            } else {
                throw new IllegalArgumentException("unexpected arg: " + a);
            }
        }
        return out;
    }

    private static Codec codecFor(String name) throws Exception {
        Reading sample = new Reading("", 0L, 0d, new ArrayList<>());
        switch (name) {
            case "kryo":
                return new KryoCodec();
            case "primed":
                return PrimedCodec.prime(new KryoCodec(), sample);
            case "pooled":
                return new PooledCodec(PrimedCodec.prime(new KryoCodec(), sample));
            case "json":
                return new JsonCodec();
            default:
                throw new IllegalArgumentException("unknown codec: " + name);
        }
    }

    private static Result runOne(String name, Codec codec, int records, int reads, int threads) throws Exception {
        try (MvStoreEngine engine = MvStoreEngine.inMemory()) {
            Store store = new Store(engine, "bench", codec);

            long start = System.nanoTime();
            for (int i = 0; i < records; i++) {
                store.put(key(i), reading(i));
            }
            double putSeconds = (System.nanoTime() - start) / 1_000_000_000.0;

            double getSeconds = readAll(store, records, reads, threads);

            AtomicLong bytes = new AtomicLong();
            engine.view(tx -> {
                tx.bucket("bench").forEach((k, v) -> bytes.addAndGet(v.length));
                return null;
            });

            return new Result(name, records / putSeconds, reads / getSeconds, bytes.get() / (double) records);
        }
    }

    private static double readAll(Store store, int records, int reads, int threads) throws Exception {
        ExecutorService exec = Executors.newFixedThreadPool(threads);
        int perThread = reads / threads;
        List<Future<?>> futures = new ArrayList<>();

        long start = System.nanoTime();
        for (int t = 0; t < threads; t++) {
            futures.add(exec.submit(() -> {
                ThreadLocalRandom rnd = ThreadLocalRandom.current();
                for (int i = 0; i < perThread; i++) {
                    store.get(key(rnd.nextInt(records)), Reading.class);
                }
            }));
        }
        for (Future<?> f : futures) {
            f.get();
        }
        double seconds = (System.nanoTime() - start) / 1_000_000_000.0;
        exec.shutdown();
        exec.awaitTermination(5, TimeUnit.SECONDS);
        return seconds;
    }

    private static byte[] key(int i) {
        return String.format("reading-%08d", i).getBytes(StandardCharsets.UTF_8);
    }

    private static Reading reading(int i) {
        return new Reading("sensor-" + (i % 64), 1_700_000_000_000L + i, i * 0.25,
                new ArrayList<>(List.of("site-" + (i % 8), "rack-" + (i % 3))));
    }
}
