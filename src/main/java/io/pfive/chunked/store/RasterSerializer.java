// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.chunked.store;

import com.esotericsoftware.kryo.Kryo;
import com.esotericsoftware.kryo.Serializer;
import com.esotericsoftware.kryo.io.Input;
import com.esotericsoftware.kryo.io.Output;
import io.pfive.chunked.geo.GridScheme;
import io.pfive.chunked.geo.Wgs84Bounds;
import io.pfive.chunked.raster.Raster;

/// Writes the grid followed by each band's name and values, in band order. The output depends
/// only on the raster's contents, so rewriting the same raster yields identical bytes.
public class RasterSerializer extends Serializer<Raster> {

    @Override
    public void write (Kryo kryo, Output output, Raster raster) {
        GridScheme grid = raster.grid;
        Wgs84Bounds bounds = grid.wgsBounds();
        output.writeDouble(bounds.minLon());
        output.writeDouble(bounds.minLat());
        output.writeDouble(bounds.widthLon());
        output.writeDouble(bounds.heightLat());
        output.writeInt(grid.nCellsWide());
        output.writeInt(grid.nCellsHigh());
        output.writeInt(raster.nBands());
        for (String name : raster.bandNames()) {
            float[] values = raster.band(name);
            output.writeString(name);
            output.writeFloats(values, 0, values.length);
        }
    }

    @Override
    public Raster read (Kryo kryo, Input input, Class<? extends Raster> type) {
        Wgs84Bounds bounds = new Wgs84Bounds(input.readDouble(), input.readDouble(),
              input.readDouble(), input.readDouble());
        GridScheme grid = new GridScheme(bounds, input.readInt(), input.readInt());
        Raster raster = new Raster(grid);
        int nBands = input.readInt();
        for (int b = 0; b < nBands; b++) {
            String name = input.readString();
            raster.putBand(name, input.readFloats(grid.nElements()));
        }
        return raster;
    }

}
