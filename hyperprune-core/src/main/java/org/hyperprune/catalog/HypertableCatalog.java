// Licensed to the Apache Software Foundation (ASF) under one
// or more contributor license agreements.  See the NOTICE file
// distributed with this work for additional information
// regarding copyright ownership.  The ASF licenses this file
// to you under the Apache License, Version 2.0 (the
// "License"); you may not use this file except in compliance
// with the License.  You may obtain a copy of the License at
//
//   http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing,
// software distributed under the License is distributed on an
// "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
// KIND, either express or implied.  See the License for the
// specific language governing permissions and limitations
// under the License.

package org.hyperprune.catalog;

import org.hyperprune.analysis.LiteralExpr;
import org.hyperprune.common.AnalysisException;
import org.hyperprune.common.MetaNotFoundException;
import org.hyperprune.common.UserException;
import org.hyperprune.persist.gson.GsonPostProcessable;
import org.hyperprune.persist.gson.GsonUtils;

import com.google.common.base.Preconditions;
import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.collect.Multimap;
import com.google.common.collect.Sets;
import com.google.gson.annotations.SerializedName;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/*
 * In-memory store of hypertables, their dimension slices and chunks.
 *
 * Lookups take the read lock and return copies, so a planning call works on a stable
 * snapshot while other threads keep adding slices and chunks.
 * The slice index and the slice -> chunk index are not persisted, they are rebuilt
 * after an image is loaded.
 */
public class HypertableCatalog implements SliceScanner, ChunkLocator, GsonPostProcessable {
    private static final Logger LOG = LogManager.getLogger(HypertableCatalog.class);

    @SerializedName(value = "nextId")
    private long nextId = 1;
    @SerializedName(value = "hypertables")
    private Map<Long, Hypertable> idToHypertable = Maps.newLinkedHashMap();
    @SerializedName(value = "slices")
    private Map<Long, DimensionSlice> idToSlice = Maps.newLinkedHashMap();
    @SerializedName(value = "chunks")
    private Map<Long, Chunk> idToChunk = Maps.newLinkedHashMap();

    private transient ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    // dimension id -> dimension
    private transient Map<Long, Dimension> idToDimension = Maps.newHashMap();
    // dimension id -> (range start -> slices)
    private transient Map<Long, NavigableMap<Long, List<DimensionSlice>>> dimensionSlices = Maps.newHashMap();
    // slice id -> chunk ids
    private transient Multimap<Long, Long> sliceToChunks = ArrayListMultimap.create();

    public HypertableCatalog() {
    }

    private void readLock() {
        this.lock.readLock().lock();
    }

    private void readUnlock() {
        this.lock.readLock().unlock();
    }

    private void writeLock() {
        this.lock.writeLock().lock();
    }

    private void writeUnlock() {
        this.lock.writeLock().unlock();
    }

    /**
     * Registers a hypertable. The dimensions get their ids here, in the given order.
     */
    public Hypertable createHypertable(String name, List<Dimension> dimensions) {
        Preconditions.checkArgument(StringUtils.isNotBlank(name), "hypertable name is blank");
        Preconditions.checkArgument(!dimensions.isEmpty(), "hypertable %s has no dimension", name);
        writeLock();
        try {
            for (Hypertable existing : idToHypertable.values()) {
                Preconditions.checkArgument(!existing.getName().equalsIgnoreCase(name),
                        "hypertable %s already exists", name);
            }
            Set<String> columns = Sets.newHashSet();
            for (Dimension dimension : dimensions) {
                Preconditions.checkArgument(columns.add(dimension.getColumnName().toLowerCase()),
                        "column %s is used by more than one dimension", dimension.getColumnName());
                Preconditions.checkArgument(!idToDimension.containsValue(dimension),
                        "dimension %s is already registered", dimension);
            }
            long hypertableId = nextId++;
            for (Dimension dimension : dimensions) {
                dimension.setIds(nextId++, hypertableId);
                idToDimension.put(dimension.getId(), dimension);
                dimensionSlices.put(dimension.getId(), new TreeMap<>());
            }
            Hypertable hypertable = new Hypertable(hypertableId, name, new Hyperspace(hypertableId, dimensions));
            idToHypertable.put(hypertableId, hypertable);
            LOG.info("create hypertable {} with dimensions {}", hypertable, dimensions);
            return hypertable;
        } finally {
            writeUnlock();
        }
    }

    public Hypertable getHypertable(long hypertableId) throws MetaNotFoundException {
        readLock();
        try {
            Hypertable hypertable = idToHypertable.get(hypertableId);
            if (hypertable == null) {
                throw new MetaNotFoundException("unknown hypertable id: " + hypertableId);
            }
            return hypertable;
        } finally {
            readUnlock();
        }
    }

    public Hypertable getHypertable(String name) throws MetaNotFoundException {
        readLock();
        try {
            for (Hypertable hypertable : idToHypertable.values()) {
                if (hypertable.getName().equalsIgnoreCase(name)) {
                    return hypertable;
                }
            }
            throw new MetaNotFoundException("unknown hypertable: " + name);
        } finally {
            readUnlock();
        }
    }

    /**
     * Returns the slice of the dimension with exactly the given range, creating it if needed.
     */
    public DimensionSlice getOrCreateSlice(long dimensionId, long rangeStart, long rangeEnd)
            throws MetaNotFoundException {
        writeLock();
        try {
            return getOrCreateSliceUnlocked(dimensionId, rangeStart, rangeEnd);
        } finally {
            writeUnlock();
        }
    }

    private DimensionSlice getOrCreateSliceUnlocked(long dimensionId, long rangeStart, long rangeEnd)
            throws MetaNotFoundException {
        NavigableMap<Long, List<DimensionSlice>> slices = getSliceIndex(dimensionId);
        List<DimensionSlice> sameStart = slices.computeIfAbsent(rangeStart, k -> Lists.newArrayList());
        for (DimensionSlice slice : sameStart) {
            if (slice.getRangeEnd() == rangeEnd) {
                return slice;
            }
        }
        DimensionSlice slice = new DimensionSlice(nextId++, dimensionId, rangeStart, rangeEnd);
        sameStart.add(slice);
        idToSlice.put(slice.getId(), slice);
        LOG.debug("create slice {} in dimension {}", slice, dimensionId);
        return slice;
    }

    /**
     * Creates a chunk made of the given slices, one per dimension of the hypertable, or
     * returns the existing chunk with exactly these slices.
     */
    public Chunk createChunk(long hypertableId, List<Long> sliceIds) throws MetaNotFoundException {
        writeLock();
        try {
            Hypertable hypertable = idToHypertable.get(hypertableId);
            if (hypertable == null) {
                throw new MetaNotFoundException("unknown hypertable id: " + hypertableId);
            }
            Hyperspace space = hypertable.getSpace();
            Preconditions.checkArgument(sliceIds.size() == space.getNumDimensions(),
                    "expect %s slices, got %s", space.getNumDimensions(), sliceIds.size());
            Map<Long, Long> dimensionToSlice = Maps.newLinkedHashMap();
            for (int i = 0; i < space.getNumDimensions(); i++) {
                DimensionSlice slice = idToSlice.get(sliceIds.get(i));
                if (slice == null) {
                    throw new MetaNotFoundException("unknown slice id: " + sliceIds.get(i));
                }
                long dimensionId = space.getDimension(i).getId();
                Preconditions.checkArgument(slice.getDimensionId() == dimensionId,
                        "slice %s does not belong to dimension %s", slice, dimensionId);
                dimensionToSlice.put(dimensionId, slice.getId());
            }
            return getOrCreateChunkUnlocked(hypertable, dimensionToSlice);
        } finally {
            writeUnlock();
        }
    }

    /**
     * Returns the chunk which holds a row with the given dimension column values, creating
     * the chunk and its slices if they do not exist yet.
     */
    public Chunk getOrCreateChunk(long hypertableId, Map<String, LiteralExpr> point) throws UserException {
        Map<String, LiteralExpr> values = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        values.putAll(point);
        writeLock();
        try {
            Hypertable hypertable = idToHypertable.get(hypertableId);
            if (hypertable == null) {
                throw new MetaNotFoundException("unknown hypertable id: " + hypertableId);
            }
            Map<Long, Long> dimensionToSlice = Maps.newLinkedHashMap();
            for (Dimension dimension : hypertable.getSpace().getDimensions()) {
                LiteralExpr value = values.get(dimension.getColumnName());
                if (value == null) {
                    throw new AnalysisException("no value for dimension column " + dimension.getColumnName());
                }
                long[] range;
                if (dimension.isOpen()) {
                    range = dimension.calculateOpenSliceRange(
                            TimeValues.toInternal(value, dimension.getColumnType()));
                } else {
                    range = dimension.calculateClosedSliceRange(dimension.getPartitioning().apply(value));
                }
                DimensionSlice slice = getOrCreateSliceUnlocked(dimension.getId(), range[0], range[1]);
                dimensionToSlice.put(dimension.getId(), slice.getId());
            }
            return getOrCreateChunkUnlocked(hypertable, dimensionToSlice);
        } finally {
            writeUnlock();
        }
    }

    private Chunk getOrCreateChunkUnlocked(Hypertable hypertable, Map<Long, Long> dimensionToSlice) {
        Long firstSliceId = dimensionToSlice.values().iterator().next();
        for (Long chunkId : sliceToChunks.get(firstSliceId)) {
            Chunk chunk = idToChunk.get(chunkId);
            if (chunk.getDimensionToSlice().equals(dimensionToSlice)) {
                return chunk;
            }
        }
        long chunkId = nextId++;
        Chunk chunk = new Chunk(chunkId, hypertable.getId(),
                "_hyper_" + hypertable.getId() + "_" + chunkId + "_chunk", dimensionToSlice);
        idToChunk.put(chunkId, chunk);
        for (Long sliceId : dimensionToSlice.values()) {
            sliceToChunks.put(sliceId, chunkId);
        }
        LOG.debug("create chunk {} of hypertable {}", chunk, hypertable);
        return chunk;
    }

    public Chunk getChunk(long chunkId) throws MetaNotFoundException {
        readLock();
        try {
            Chunk chunk = idToChunk.get(chunkId);
            if (chunk == null) {
                throw new MetaNotFoundException("unknown chunk id: " + chunkId);
            }
            return chunk;
        } finally {
            readUnlock();
        }
    }

    public DimensionSlice getSlice(long sliceId) throws MetaNotFoundException {
        readLock();
        try {
            DimensionSlice slice = idToSlice.get(sliceId);
            if (slice == null) {
                throw new MetaNotFoundException("unknown slice id: " + sliceId);
            }
            return slice;
        } finally {
            readUnlock();
        }
    }

    private NavigableMap<Long, List<DimensionSlice>> getSliceIndex(long dimensionId) throws MetaNotFoundException {
        NavigableMap<Long, List<DimensionSlice>> slices = dimensionSlices.get(dimensionId);
        if (slices == null) {
            throw new MetaNotFoundException("unknown dimension id: " + dimensionId);
        }
        return slices;
    }

    @Override
    public DimensionSliceSet scanRange(long dimensionId,
                                       ComparisonStrategy upperStrategy, long upperBound,
                                       ComparisonStrategy lowerStrategy, long lowerBound,
                                       int limit) throws MetaNotFoundException {
        // turn both bounds into an inclusive interval [lower, upper]
        long upper = DimensionSlice.MAX_VALUE;
        long lower = DimensionSlice.MIN_VALUE;
        boolean empty = false;
        if (upperStrategy != null) {
            Preconditions.checkArgument(upperStrategy.isUpperBound(), "invalid upper strategy %s", upperStrategy);
            if (upperStrategy == ComparisonStrategy.LESS_EQUAL) {
                upper = upperBound;
            } else if (upperBound == Long.MIN_VALUE) {
                empty = true;
            } else {
                upper = upperBound - 1;
            }
        }
        if (lowerStrategy != null) {
            Preconditions.checkArgument(lowerStrategy.isLowerBound(), "invalid lower strategy %s", lowerStrategy);
            if (lowerStrategy == ComparisonStrategy.GREATER_EQUAL) {
                lower = lowerBound;
            } else if (lowerBound == Long.MAX_VALUE) {
                empty = true;
            } else {
                lower = lowerBound + 1;
            }
        }

        DimensionSliceSet result = new DimensionSliceSet();
        readLock();
        try {
            NavigableMap<Long, List<DimensionSlice>> slices = getSliceIndex(dimensionId);
            if (empty || lower > upper) {
                return result;
            }
            for (List<DimensionSlice> sameStart : slices.headMap(upper, true).values()) {
                for (DimensionSlice slice : sameStart) {
                    if (slice.overlaps(lower, upper)) {
                        result.addUnique(slice);
                        if (limit > 0 && result.size() >= limit) {
                            return result;
                        }
                    }
                }
            }
        } finally {
            readUnlock();
        }
        return result;
    }

    @Override
    public DimensionSliceSet scanAll(long dimensionId, int limit) throws MetaNotFoundException {
        return scanRange(dimensionId, null, 0, null, 0, limit);
    }

    @Override
    public List<Long> findChunkIds(Hyperspace space, List<DimensionSliceSet> candidates)
            throws MetaNotFoundException {
        Preconditions.checkArgument(candidates.size() == space.getNumDimensions(),
                "expect %s candidate slice sets, got %s", space.getNumDimensions(), candidates.size());
        // drive the join from the dimension with the fewest candidates
        int driving = 0;
        for (int i = 1; i < candidates.size(); i++) {
            if (candidates.get(i).size() < candidates.get(driving).size()) {
                driving = i;
            }
        }

        List<Long> chunkIds = Lists.newArrayList();
        readLock();
        try {
            if (!idToHypertable.containsKey(space.getHypertableId())) {
                throw new MetaNotFoundException("unknown hypertable id: " + space.getHypertableId());
            }
            for (Long sliceId : candidates.get(driving).getSliceIds()) {
                for (Long chunkId : sliceToChunks.get(sliceId)) {
                    Chunk chunk = idToChunk.get(chunkId);
                    if (chunk.getHypertableId() == space.getHypertableId() && matches(chunk, space, candidates)) {
                        chunkIds.add(chunkId);
                    }
                }
            }
        } finally {
            readUnlock();
        }
        Collections.sort(chunkIds);
        return chunkIds;
    }

    private static boolean matches(Chunk chunk, Hyperspace space, List<DimensionSliceSet> candidates) {
        for (int i = 0; i < space.getNumDimensions(); i++) {
            long sliceId = chunk.getSliceId(space.getDimension(i).getId());
            if (!candidates.get(i).containsSliceId(sliceId)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public List<Long> getAllChunkIds(long hypertableId) throws MetaNotFoundException {
        List<Long> chunkIds = Lists.newArrayList();
        readLock();
        try {
            if (!idToHypertable.containsKey(hypertableId)) {
                throw new MetaNotFoundException("unknown hypertable id: " + hypertableId);
            }
            for (Chunk chunk : idToChunk.values()) {
                if (chunk.getHypertableId() == hypertableId) {
                    chunkIds.add(chunk.getId());
                }
            }
        } finally {
            readUnlock();
        }
        Collections.sort(chunkIds);
        return chunkIds;
    }

    public void saveImage(Writer writer) throws IOException {
        readLock();
        try {
            GsonUtils.GSON.toJson(this, writer);
            writer.flush();
            LOG.info("saved catalog image with {} hypertables, {} slices, {} chunks",
                    idToHypertable.size(), idToSlice.size(), idToChunk.size());
        } finally {
            readUnlock();
        }
    }

    public static HypertableCatalog loadImage(Reader reader) throws IOException {
        HypertableCatalog catalog = GsonUtils.GSON.fromJson(reader, HypertableCatalog.class);
        if (catalog == null) {
            throw new IOException("empty catalog image");
        }
        LOG.info("loaded catalog image with {} hypertables, {} slices, {} chunks",
                catalog.idToHypertable.size(), catalog.idToSlice.size(), catalog.idToChunk.size());
        return catalog;
    }

    @Override
    public void gsonPostProcess() throws IOException {
        lock = new ReentrantReadWriteLock();
        idToDimension = Maps.newHashMap();
        dimensionSlices = Maps.newHashMap();
        sliceToChunks = ArrayListMultimap.create();
        for (Hypertable hypertable : idToHypertable.values()) {
            for (Dimension dimension : hypertable.getSpace().getDimensions()) {
                idToDimension.put(dimension.getId(), dimension);
                dimensionSlices.put(dimension.getId(), new TreeMap<>());
            }
        }
        for (DimensionSlice slice : idToSlice.values()) {
            NavigableMap<Long, List<DimensionSlice>> slices = dimensionSlices.get(slice.getDimensionId());
            if (slices == null) {
                throw new IOException("slice " + slice + " refers to unknown dimension " + slice.getDimensionId());
            }
            slices.computeIfAbsent(slice.getRangeStart(), k -> Lists.newArrayList()).add(slice);
        }
        for (Chunk chunk : idToChunk.values()) {
            for (Long sliceId : chunk.getDimensionToSlice().values()) {
                sliceToChunks.put(sliceId, chunk.getId());
            }
        }
    }
}
